package edu.brandeis.cosi103a.golfleague.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One player's line in the season standings.
 */
public record StandingsEntry(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("matchesPlayed") int matchesPlayed,
    @JsonProperty("matchesWon") int matchesWon,
    @JsonProperty("matchesLost") int matchesLost,
    @JsonProperty("matchesTied") int matchesTied,
    @JsonProperty("totalPoints") int totalPoints
) {
    static StandingsEntry empty(String playerId) {
        return new StandingsEntry(playerId, 0, 0, 0, 0, 0);
    }

    StandingsEntry plus(int pointsFor, int pointsAgainst) {
        return new StandingsEntry(
            playerId,
            matchesPlayed + 1,
            matchesWon + (pointsFor > pointsAgainst ? 1 : 0),
            matchesLost + (pointsFor < pointsAgainst ? 1 : 0),
            matchesTied + (pointsFor == pointsAgainst ? 1 : 0),
            totalPoints + pointsFor);
    }
}

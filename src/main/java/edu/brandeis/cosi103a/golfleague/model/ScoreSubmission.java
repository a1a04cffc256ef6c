package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One player's submitted card for a match. Hole scores may be empty when the player is absent;
 * length, sign and missing values are checked against the course by the workflow.
 */
public record ScoreSubmission(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("matchId") String matchId,
    @JsonProperty("holeScores") List<Integer> holeScores,
    @JsonProperty("absent") boolean absent
) {
    public ScoreSubmission {
        holeScores = holeScores == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(holeScores));
    }

    public static ScoreSubmission absent(String playerId, String matchId) {
        return new ScoreSubmission(playerId, matchId, List.of(), true);
    }
}

package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything computed for one player's card in one match. This is also the
 * player's handicap history: non-absent records carry the differential.
 *
 * @param matchId              match the card belongs to
 * @param playerId             player who played (or missed) the round
 * @param matchDayId           match day of the match
 * @param date                 date of play
 * @param courseId             course played
 * @param holeScores           gross per hole (synthetic when absent)
 * @param adjustedHoleScores   net double bogey adjusted per hole
 * @param grossTotal           sum of hole scores
 * @param adjustedTotal        sum of adjusted hole scores
 * @param differential         differential for the round, empty when absent
 * @param handicapIndex        index used for this round
 * @param courseHandicap       rounded course handicap
 * @param playingHandicap      playing handicap
 * @param matchStrokes         strokes received per hole in the match, empty until the opponent has scored
 * @param matchNetHoleScores   gross minus match strokes per hole, empty until the opponent has scored
 * @param absent               whether the player was absent
 */
public record ScoreRecord(
    @JsonProperty("matchId") String matchId,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("matchDayId") String matchDayId,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("courseId") String courseId,
    @JsonProperty("holeScores") List<Integer> holeScores,
    @JsonProperty("adjustedHoleScores") List<Integer> adjustedHoleScores,
    @JsonProperty("grossTotal") int grossTotal,
    @JsonProperty("adjustedTotal") int adjustedTotal,
    @JsonProperty("differential") Optional<Double> differential,
    @JsonProperty("handicapIndex") double handicapIndex,
    @JsonProperty("courseHandicap") int courseHandicap,
    @JsonProperty("playingHandicap") int playingHandicap,
    @JsonProperty("matchStrokes") List<Integer> matchStrokes,
    @JsonProperty("matchNetHoleScores") List<Integer> matchNetHoleScores,
    @JsonProperty("absent") boolean absent
) {
    public ScoreRecord {
        holeScores = List.copyOf(holeScores);
        adjustedHoleScores = List.copyOf(adjustedHoleScores);
        differential = differential == null ? Optional.empty() : differential;
        matchStrokes = matchStrokes == null ? List.of() : List.copyOf(matchStrokes);
        matchNetHoleScores = matchNetHoleScores == null ? List.of() : List.copyOf(matchNetHoleScores);
    }

    public int matchNetTotal() {
        int total = 0;
        for (int net : matchNetHoleScores) {
            total += net;
        }
        return total;
    }

    /**
     * The differential as a dated handicap input, empty for absent rounds.
     */
    public Optional<Differential> asDifferential() {
        return differential.map(value -> new Differential(value, date));
    }

    public ScoreRecord withMatchStrokes(List<Integer> strokes) {
        List<Integer> net = new ArrayList<>(holeScores.size());
        for (int i = 0; i < holeScores.size(); i++) {
            net.add(holeScores.get(i) - strokes.get(i));
        }
        return new ScoreRecord(matchId, playerId, matchDayId, date, courseId, holeScores, adjustedHoleScores,
            grossTotal, adjustedTotal, differential, handicapIndex, courseHandicap, playingHandicap,
            strokes, net, absent);
    }
}

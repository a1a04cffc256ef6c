package edu.brandeis.cosi103a.golfleague.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.golfleague.model.ScoreSubmission;

import java.util.List;

/**
 * DTO for one player's card in a score entry request. Field checks happen per card in the
 * workflow so one bad card does not sink the rest of the batch.
 */
public record ScoreEntryRequest(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("matchId") String matchId,
    @JsonProperty("holeScores") List<Integer> holeScores,
    @JsonProperty("absent") boolean absent
) {
    public ScoreSubmission toSubmission() {
        return new ScoreSubmission(playerId, matchId, holeScores, absent);
    }
}

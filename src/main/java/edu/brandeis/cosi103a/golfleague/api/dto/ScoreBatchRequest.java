package edu.brandeis.cosi103a.golfleague.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.golfleague.model.ScoreSubmission;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * DTO for a batch of cards entered for one match day.
 */
public record ScoreBatchRequest(
    @JsonProperty("scores") @NotEmpty List<ScoreEntryRequest> scores
) {
    /**
     * Null entries are passed through as null submissions and come back as warnings.
     */
    public List<ScoreSubmission> toSubmissions() {
        return scores.stream()
            .map(entry -> entry == null ? null : entry.toSubmission())
            .toList();
    }
}

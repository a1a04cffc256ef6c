package edu.brandeis.cosi103a.golfleague.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.golfleague.model.MatchDayStatus;
import edu.brandeis.cosi103a.golfleague.model.MatchPoints;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one score batch for a match day.
 *
 * @param matchDayId          the match day scored
 * @param committed           number of submissions saved
 * @param updated             true if the day already had scores before this batch
 * @param status              the day's status after the batch
 * @param warnings            one message per rejected submission
 * @param deferredMatchIds    touched matches still waiting on the other player's score
 * @param points              points per match settled by this batch
 * @param lockedMatchDayIds   earlier match days locked by this batch
 */
public record ScoreBatchResult(
    @JsonProperty("matchDayId") String matchDayId,
    @JsonProperty("committed") int committed,
    @JsonProperty("updated") boolean updated,
    @JsonProperty("status") MatchDayStatus status,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("deferredMatchIds") List<String> deferredMatchIds,
    @JsonProperty("points") Map<String, MatchPoints> points,
    @JsonProperty("lockedMatchDayIds") List<String> lockedMatchDayIds
) {
    public ScoreBatchResult {
        warnings = List.copyOf(warnings);
        deferredMatchIds = List.copyOf(deferredMatchIds);
        points = Map.copyOf(points);
        lockedMatchDayIds = List.copyOf(lockedMatchDayIds);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

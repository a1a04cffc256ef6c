package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A league night: every match of a season played at one course on one date.
 */
public record MatchDay(
    @JsonProperty("id") String id,
    @JsonProperty("seasonId") String seasonId,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("courseId") String courseId,
    @JsonProperty("status") MatchDayStatus status
) {
    public MatchDay {
        checkNotNull(id, "match day id");
        checkNotNull(seasonId, "seasonId for match day %s", id);
        checkNotNull(date, "date for match day %s", id);
        checkNotNull(courseId, "courseId for match day %s", id);
        status = status == null ? MatchDayStatus.SCHEDULED : status;
    }

    /**
     * Returns a copy in the given status.
     *
     * @throws IllegalStateException if the transition would move backwards
     */
    public MatchDay withStatus(MatchDayStatus next) {
        checkState(status.canTransitionTo(next),
            "Match day %s cannot move from %s to %s", id, status, next);
        return new MatchDay(id, seasonId, date, courseId, next);
    }

    public boolean isBefore(MatchDay other) {
        return date.isBefore(other.date);
    }
}

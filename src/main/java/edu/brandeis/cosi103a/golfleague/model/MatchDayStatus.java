package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a match day. Transitions only move forward; {@link #LOCKED} is terminal.
 */
public enum MatchDayStatus {
    @JsonProperty("scheduled") SCHEDULED,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("locked") LOCKED;

    public boolean acceptsScores() {
        return this != LOCKED;
    }

    public boolean canTransitionTo(MatchDayStatus next) {
        return next.ordinal() >= ordinal();
    }
}

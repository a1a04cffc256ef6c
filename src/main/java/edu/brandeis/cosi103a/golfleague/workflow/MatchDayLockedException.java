package edu.brandeis.cosi103a.golfleague.workflow;

/**
 * Thrown when scores are submitted for a locked match day. Nothing is written.
 */
public class MatchDayLockedException extends IllegalStateException {

    private final String matchDayId;

    public MatchDayLockedException(String matchDayId) {
        super("Match day " + matchDayId + " is locked and scores cannot be modified");
        this.matchDayId = matchDayId;
    }

    public String getMatchDayId() {
        return matchDayId;
    }
}

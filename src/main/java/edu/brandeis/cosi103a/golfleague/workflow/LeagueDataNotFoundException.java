package edu.brandeis.cosi103a.golfleague.workflow;

/**
 * Thrown when a requested match day, course or player cannot be found.
 */
public class LeagueDataNotFoundException extends RuntimeException {
    public LeagueDataNotFoundException(String message) {
        super(message);
    }
}

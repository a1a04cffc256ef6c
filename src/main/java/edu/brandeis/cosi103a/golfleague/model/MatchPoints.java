package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Points earned by player A and player B in one match. Always sums to {@link #TOTAL}.
 */
public record MatchPoints(
    @JsonProperty("playerAPoints") int playerAPoints,
    @JsonProperty("playerBPoints") int playerBPoints
) {
    public static final int TOTAL = 22;

    public MatchPoints {
        checkArgument(playerAPoints >= 0 && playerBPoints >= 0,
            "Match points must not be negative: %s-%s", playerAPoints, playerBPoints);
        checkArgument(playerAPoints + playerBPoints == TOTAL,
            "Match points must sum to %s: %s-%s", TOTAL, playerAPoints, playerBPoints);
    }
}

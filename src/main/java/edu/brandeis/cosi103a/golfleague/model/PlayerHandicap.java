package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A player's league handicap state.
 *
 * @param playerId            player identifier
 * @param provisionalHandicap seed assigned at enrollment
 * @param handicapIndex       current league handicap index
 * @param roundsCounted       number of qualifying differentials behind the index (at most 5)
 * @param established         whether the player has five or more qualifying scores
 */
public record PlayerHandicap(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("provisionalHandicap") double provisionalHandicap,
    @JsonProperty("handicapIndex") double handicapIndex,
    @JsonProperty("roundsCounted") int roundsCounted,
    @JsonProperty("established") boolean established
) {
    public PlayerHandicap {
        checkNotNull(playerId, "playerId");
        checkArgument(roundsCounted >= 0, "roundsCounted must not be negative: %s", roundsCounted);
    }

    /**
     * A freshly enrolled player whose index is still the provisional seed.
     */
    public static PlayerHandicap provisional(String playerId, double provisionalHandicap) {
        return new PlayerHandicap(playerId, provisionalHandicap, provisionalHandicap, 0, false);
    }
}

package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Per-hole strokes for the two players of a match, keyed by player id.
 * At most one player holds non-zero strokes.
 */
public record MatchStrokes(
    @JsonProperty("strokesByPlayer") Map<String, List<Integer>> strokesByPlayer
) {
    public MatchStrokes {
        ImmutableMap.Builder<String, List<Integer>> copy = ImmutableMap.builder();
        strokesByPlayer.forEach((player, strokes) -> copy.put(player, ImmutableList.copyOf(strokes)));
        strokesByPlayer = copy.build();
    }

    public List<Integer> forPlayer(String playerId) {
        List<Integer> strokes = strokesByPlayer.get(playerId);
        checkArgument(strokes != null, "No strokes allocated for player %s", playerId);
        return strokes;
    }

    /**
     * The player receiving strokes, or empty when the handicaps were equal.
     */
    public Optional<String> receivingPlayer() {
        return strokesByPlayer.entrySet().stream()
            .filter(e -> e.getValue().stream().anyMatch(s -> s != 0))
            .map(Map.Entry::getKey)
            .findFirst();
    }
}

package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A head-to-head match between two players on a match day.
 * Points stay empty until both players have a score on record.
 */
public record Match(
    @JsonProperty("id") String id,
    @JsonProperty("matchDayId") String matchDayId,
    @JsonProperty("playerAId") String playerAId,
    @JsonProperty("playerBId") String playerBId,
    @JsonProperty("status") MatchDayStatus status,
    @JsonProperty("points") Optional<MatchPoints> points
) {
    public Match {
        checkNotNull(id, "match id");
        checkNotNull(matchDayId, "matchDayId for match %s", id);
        checkNotNull(playerAId, "playerAId for match %s", id);
        checkNotNull(playerBId, "playerBId for match %s", id);
        checkArgument(!playerAId.equals(playerBId), "Match %s pairs player %s with themselves", id, playerAId);
        status = status == null ? MatchDayStatus.SCHEDULED : status;
        points = points == null ? Optional.empty() : points;
    }

    public static Match scheduled(String id, String matchDayId, String playerAId, String playerBId) {
        return new Match(id, matchDayId, playerAId, playerBId, MatchDayStatus.SCHEDULED, Optional.empty());
    }

    public boolean involves(String playerId) {
        return playerAId.equals(playerId) || playerBId.equals(playerId);
    }

    public String opponentOf(String playerId) {
        checkArgument(involves(playerId), "Player %s is not in match %s", playerId, id);
        return playerAId.equals(playerId) ? playerBId : playerAId;
    }

    /**
     * Returns a copy carrying the given points. The status is left alone; it follows the
     * match day.
     */
    public Match withPoints(MatchPoints newPoints) {
        return new Match(id, matchDayId, playerAId, playerBId, status, Optional.of(newPoints));
    }

    public Match withStatus(MatchDayStatus next) {
        return new Match(id, matchDayId, playerAId, playerBId, next, points);
    }
}

package edu.brandeis.cosi103a.golfleague.scoring;

import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchPoints;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Season standings from the matches that have points.
 */
public final class StandingsCalculator {

    private static final Comparator<StandingsEntry> ORDER =
        Comparator.comparingInt(StandingsEntry::totalPoints).reversed()
            .thenComparing(Comparator.comparingInt(StandingsEntry::matchesWon).reversed())
            .thenComparing(StandingsEntry::playerId);

    private StandingsCalculator() {}

    /**
     * @param playerIds players to list even if they have not played yet
     * @param matches   matches of the season; those without points are skipped
     * @return standings, most points first, then most wins, then player id
     */
    public static List<StandingsEntry> standings(Collection<String> playerIds, Collection<Match> matches) {
        Map<String, StandingsEntry> entries = new LinkedHashMap<>();
        for (String playerId : playerIds) {
            entries.put(playerId, StandingsEntry.empty(playerId));
        }

        for (Match match : matches) {
            if (match.points().isEmpty()) {
                continue;
            }
            MatchPoints points = match.points().get();
            entries.merge(match.playerAId(),
                StandingsEntry.empty(match.playerAId()).plus(points.playerAPoints(), points.playerBPoints()),
                (current, ignored) -> current.plus(points.playerAPoints(), points.playerBPoints()));
            entries.merge(match.playerBId(),
                StandingsEntry.empty(match.playerBId()).plus(points.playerBPoints(), points.playerAPoints()),
                (current, ignored) -> current.plus(points.playerBPoints(), points.playerAPoints()));
        }

        List<StandingsEntry> result = new ArrayList<>(entries.values());
        result.sort(ORDER);
        return result;
    }
}

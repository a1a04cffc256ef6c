package edu.brandeis.cosi103a.golfleague.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchDay;
import edu.brandeis.cosi103a.golfleague.scoring.StandingsCalculator;
import edu.brandeis.cosi103a.golfleague.scoring.StandingsEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only views over a season.
 */
public final class SeasonReports {

    private SeasonReports() {}

    /**
     * A match day with its week number within the season.
     */
    public record ScheduledMatchDay(
        @JsonProperty("matchDay") MatchDay matchDay,
        @JsonProperty("weekNumber") int weekNumber,
        @JsonProperty("hasScores") boolean hasScores
    ) {}

    /**
     * Match days of a season in date order, numbered from week 1.
     */
    public static List<ScheduledMatchDay> schedule(LeagueStore store, String seasonId) {
        List<MatchDay> days = new ArrayList<>(store.listMatchDays(seasonId));
        days.sort(Comparator.comparing(MatchDay::date).thenComparing(MatchDay::id));

        List<ScheduledMatchDay> result = new ArrayList<>(days.size());
        for (int i = 0; i < days.size(); i++) {
            MatchDay day = days.get(i);
            boolean hasScores = !store.listScoresForMatchDay(day.id()).isEmpty();
            result.add(new ScheduledMatchDay(day, i + 1, hasScores));
        }
        return result;
    }

    public static List<StandingsEntry> standings(LeagueStore store, String seasonId) {
        Set<String> players = new LinkedHashSet<>();
        List<Match> matches = new ArrayList<>();
        for (MatchDay day : store.listMatchDays(seasonId)) {
            for (Match match : store.listMatches(day.id())) {
                players.add(match.playerAId());
                players.add(match.playerBId());
                matches.add(match);
            }
        }
        return StandingsCalculator.standings(players, matches);
    }
}

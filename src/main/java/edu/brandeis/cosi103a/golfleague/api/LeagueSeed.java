package edu.brandeis.cosi103a.golfleague.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchDay;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;
import edu.brandeis.cosi103a.golfleague.workflow.InMemoryLeagueStore;

import java.util.List;

/**
 * Startup data for a league: courses, enrolled players with their provisional handicaps,
 * and the season schedule.
 */
public record LeagueSeed(
    @JsonProperty("courses") List<Course> courses,
    @JsonProperty("players") List<PlayerSeed> players,
    @JsonProperty("matchDays") List<MatchDay> matchDays,
    @JsonProperty("matches") List<Match> matches
) {
    public LeagueSeed {
        courses = courses == null ? List.of() : List.copyOf(courses);
        players = players == null ? List.of() : List.copyOf(players);
        matchDays = matchDays == null ? List.of() : List.copyOf(matchDays);
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    /**
     * An enrolled player and the seed handicap their index starts from.
     */
    public record PlayerSeed(
        @JsonProperty("playerId") String playerId,
        @JsonProperty("provisionalHandicap") double provisionalHandicap
    ) {}

    public void applyTo(InMemoryLeagueStore store) {
        courses.forEach(store::saveCourse);
        players.forEach(p -> store.saveHandicap(PlayerHandicap.provisional(p.playerId(), p.provisionalHandicap())));
        matchDays.forEach(store::saveMatchDay);
        matches.forEach(store::saveMatch);
    }
}

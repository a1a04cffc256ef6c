package edu.brandeis.cosi103a.golfleague.workflow;

import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchDay;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;
import edu.brandeis.cosi103a.golfleague.model.ScoreRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence collaborator for one league. The workflow reads and writes only through this
 * interface and holds no state of its own.
 */
public interface LeagueStore {

    Optional<Course> findCourse(String courseId);

    Optional<MatchDay> findMatchDay(String matchDayId);

    /**
     * All match days of a season, in no particular order.
     */
    List<MatchDay> listMatchDays(String seasonId);

    void saveMatchDay(MatchDay matchDay);

    Optional<Match> findMatch(String matchId);

    List<Match> listMatches(String matchDayId);

    void saveMatch(Match match);

    Optional<PlayerHandicap> findHandicap(String playerId);

    void saveHandicap(PlayerHandicap handicap);

    Optional<ScoreRecord> findScore(String matchId, String playerId);

    List<ScoreRecord> listScoresForMatchDay(String matchDayId);

    List<ScoreRecord> listScoresForPlayer(String playerId);

    /**
     * Inserts or replaces the record for (matchId, playerId).
     */
    void saveScore(ScoreRecord score);

    /**
     * Runs {@code work} as one atomic unit, mutually exclusive with any other transaction on
     * the same season. If {@code work} throws, none of its writes are kept.
     */
    <T> T inTransaction(String seasonId, Supplier<T> work);
}

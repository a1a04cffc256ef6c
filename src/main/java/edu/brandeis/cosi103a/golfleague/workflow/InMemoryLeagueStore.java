package edu.brandeis.cosi103a.golfleague.workflow;

import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchDay;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;
import edu.brandeis.cosi103a.golfleague.model.ScoreRecord;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Map-backed {@link LeagueStore}. Transactions take a per-season lock and keep an undo
 * journal so a failed unit of work leaves no writes behind.
 *
 * <p>Only writers are isolated. Reads outside {@link #inTransaction} take no lock, so they may
 * see writes from a unit of work that is still running and may yet be rolled back.
 */
public class InMemoryLeagueStore implements LeagueStore {

    private final Map<String, Course> courses = new ConcurrentHashMap<>();
    private final Map<String, MatchDay> matchDays = new ConcurrentHashMap<>();
    private final Map<String, Match> matches = new ConcurrentHashMap<>();
    private final Map<String, PlayerHandicap> handicaps = new ConcurrentHashMap<>();
    private final Map<String, ScoreRecord> scores = new ConcurrentHashMap<>();

    private final Map<String, ReentrantLock> seasonLocks = new ConcurrentHashMap<>();
    private final ThreadLocal<Deque<Runnable>> undoJournal = new ThreadLocal<>();

    public void saveCourse(Course course) {
        put(courses, course.id(), course);
    }

    @Override
    public Optional<Course> findCourse(String courseId) {
        return Optional.ofNullable(courses.get(courseId));
    }

    @Override
    public Optional<MatchDay> findMatchDay(String matchDayId) {
        return Optional.ofNullable(matchDays.get(matchDayId));
    }

    @Override
    public List<MatchDay> listMatchDays(String seasonId) {
        return matchDays.values().stream()
            .filter(md -> md.seasonId().equals(seasonId))
            .sorted(Comparator.comparing(MatchDay::date).thenComparing(MatchDay::id))
            .toList();
    }

    @Override
    public void saveMatchDay(MatchDay matchDay) {
        put(matchDays, matchDay.id(), matchDay);
    }

    @Override
    public Optional<Match> findMatch(String matchId) {
        return Optional.ofNullable(matches.get(matchId));
    }

    @Override
    public List<Match> listMatches(String matchDayId) {
        return matches.values().stream()
            .filter(m -> m.matchDayId().equals(matchDayId))
            .sorted(Comparator.comparing(Match::id))
            .toList();
    }

    @Override
    public void saveMatch(Match match) {
        put(matches, match.id(), match);
    }

    @Override
    public Optional<PlayerHandicap> findHandicap(String playerId) {
        return Optional.ofNullable(handicaps.get(playerId));
    }

    @Override
    public void saveHandicap(PlayerHandicap handicap) {
        put(handicaps, handicap.playerId(), handicap);
    }

    @Override
    public Optional<ScoreRecord> findScore(String matchId, String playerId) {
        return Optional.ofNullable(scores.get(scoreKey(matchId, playerId)));
    }

    @Override
    public List<ScoreRecord> listScoresForMatchDay(String matchDayId) {
        return scores.values().stream()
            .filter(s -> s.matchDayId().equals(matchDayId))
            .sorted(Comparator.comparing(ScoreRecord::matchId).thenComparing(ScoreRecord::playerId))
            .toList();
    }

    @Override
    public List<ScoreRecord> listScoresForPlayer(String playerId) {
        return scores.values().stream()
            .filter(s -> s.playerId().equals(playerId))
            .sorted(Comparator.comparing(ScoreRecord::date).thenComparing(ScoreRecord::matchId))
            .toList();
    }

    @Override
    public void saveScore(ScoreRecord score) {
        put(scores, scoreKey(score.matchId(), score.playerId()), score);
    }

    @Override
    public <T> T inTransaction(String seasonId, Supplier<T> work) {
        ReentrantLock lock = seasonLocks.computeIfAbsent(seasonId, k -> new ReentrantLock());
        lock.lock();
        try {
            if (undoJournal.get() != null) {
                // already inside a unit of work on this thread
                return work.get();
            }
            Deque<Runnable> journal = new ArrayDeque<>();
            undoJournal.set(journal);
            try {
                return work.get();
            } catch (RuntimeException e) {
                while (!journal.isEmpty()) {
                    journal.pop().run();
                }
                throw e;
            } finally {
                undoJournal.remove();
            }
        } finally {
            lock.unlock();
        }
    }

    private <V> void put(Map<String, V> map, String key, V value) {
        V previous = map.put(key, value);
        Deque<Runnable> journal = undoJournal.get();
        if (journal != null) {
            journal.push(previous == null ? () -> map.remove(key) : () -> map.put(key, previous));
        }
    }

    private static String scoreKey(String matchId, String playerId) {
        return matchId + "_" + playerId;
    }
}

package edu.brandeis.cosi103a.golfleague.workflow;

import edu.brandeis.cosi103a.golfleague.handicap.AbsenceHandler;
import edu.brandeis.cosi103a.golfleague.handicap.DifferentialCalculator;
import edu.brandeis.cosi103a.golfleague.handicap.HandicapConverter;
import edu.brandeis.cosi103a.golfleague.handicap.HandicapIndexCalculator;
import edu.brandeis.cosi103a.golfleague.handicap.HandicapRounding;
import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.CourseHandicaps;
import edu.brandeis.cosi103a.golfleague.model.Differential;
import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchDay;
import edu.brandeis.cosi103a.golfleague.model.MatchDayStatus;
import edu.brandeis.cosi103a.golfleague.model.MatchPoints;
import edu.brandeis.cosi103a.golfleague.model.MatchStrokes;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;
import edu.brandeis.cosi103a.golfleague.model.ScoreRecord;
import edu.brandeis.cosi103a.golfleague.model.ScoreSubmission;
import edu.brandeis.cosi103a.golfleague.scoring.MatchPointCalculator;
import edu.brandeis.cosi103a.golfleague.scoring.NetDoubleBogeyAdjuster;
import edu.brandeis.cosi103a.golfleague.scoring.StrokeAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a batch of submitted cards to a match day.
 *
 * <p>For every valid card the player's course and playing handicap are derived from the index
 * they carried into the round, the card is adjusted (or synthesised for an absent player) and
 * stored, and the player's index is recomputed. Matches with both cards in are settled for
 * points. The first batch for a day locks every earlier day of the season; a day moves to
 * {@link MatchDayStatus#COMPLETED} once every match on it has both cards.
 *
 * <p>Invalid cards are reported as warnings and do not stop the rest of the batch. The whole
 * batch runs in one {@link LeagueStore#inTransaction} on the day's season, and submitting the
 * same batch twice leaves the store as it was after the first time.
 */
public final class MatchDayWorkflow {

    private static final Logger log = LoggerFactory.getLogger(MatchDayWorkflow.class);

    private MatchDayWorkflow() {}

    /**
     * Submit a batch of cards for one match day.
     *
     * @throws LeagueDataNotFoundException if the match day or its course is unknown
     * @throws MatchDayLockedException     if the match day is locked
     */
    public static ScoreBatchResult submitScores(LeagueStore store, String matchDayId,
                                                List<ScoreSubmission> submissions) {
        MatchDay matchDay = requireMatchDay(store, matchDayId);
        return store.inTransaction(matchDay.seasonId(), () -> applyBatch(store, matchDayId, submissions));
    }

    private static ScoreBatchResult applyBatch(LeagueStore store, String matchDayId,
                                               List<ScoreSubmission> submissions) {
        // re-read under the season lock
        MatchDay matchDay = requireMatchDay(store, matchDayId);
        if (!matchDay.status().acceptsScores()) {
            log.warn("Rejected {} scores for locked match day {}", submissions.size(), matchDayId);
            throw new MatchDayLockedException(matchDayId);
        }
        Course course = store.findCourse(matchDay.courseId())
            .orElseThrow(() -> new LeagueDataNotFoundException("Course not found: " + matchDay.courseId()));

        boolean firstEntry = store.listScoresForMatchDay(matchDayId).isEmpty();

        List<String> warnings = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> touchedMatches = new LinkedHashSet<>();
        Set<String> handicapPlayers = new LinkedHashSet<>();
        int committed = 0;

        for (ScoreSubmission submission : submissions) {
            Optional<String> problem = validate(store, matchDay, course, submission, seen);
            if (problem.isPresent()) {
                log.warn("Skipping score on match day {}: {}", matchDayId, problem.get());
                warnings.add(problem.get());
                continue;
            }

            store.saveScore(scoreCard(store, matchDay, course, submission));
            committed++;
            touchedMatches.add(submission.matchId());
            if (!submission.absent()) {
                handicapPlayers.add(submission.playerId());
            }
        }

        for (String playerId : handicapPlayers) {
            recalculateHandicap(store, playerId);
        }

        Map<String, MatchPoints> points = new LinkedHashMap<>();
        List<String> deferred = new ArrayList<>();
        for (String matchId : touchedMatches) {
            Optional<MatchPoints> settled = settleMatch(store, course, matchId);
            if (settled.isPresent()) {
                points.put(matchId, settled.get());
            } else {
                deferred.add(matchId);
            }
        }

        MatchDay current = matchDay;
        List<String> locked = List.of();
        if (committed > 0) {
            if (current.status() == MatchDayStatus.SCHEDULED && allMatchesScored(store, current)) {
                current = current.withStatus(MatchDayStatus.COMPLETED);
                store.saveMatchDay(current);
                for (Match match : store.listMatches(current.id())) {
                    store.saveMatch(match.withStatus(MatchDayStatus.COMPLETED));
                }
                log.info("Match day {} completed", matchDayId);
            }
            if (firstEntry) {
                locked = lockEarlierMatchDays(store, current);
            }
        }

        log.info("Match day {}: {} scores saved, {} warnings, {} matches settled, {} deferred",
            matchDayId, committed, warnings.size(), points.size(), deferred.size());
        return new ScoreBatchResult(matchDayId, committed, !firstEntry, current.status(),
            warnings, deferred, points, locked);
    }

    private static Optional<String> validate(LeagueStore store, MatchDay matchDay, Course course,
                                             ScoreSubmission submission, Set<String> seen) {
        if (submission == null || isBlank(submission.playerId()) || isBlank(submission.matchId())) {
            return Optional.of("Score is missing a player or match id");
        }
        String playerId = submission.playerId();
        String matchId = submission.matchId();

        Optional<Match> match = store.findMatch(matchId);
        if (match.isEmpty()) {
            return Optional.of("Match " + matchId + " not found");
        }
        if (!match.get().matchDayId().equals(matchDay.id())) {
            return Optional.of("Match " + matchId + " is not part of match day " + matchDay.id());
        }
        if (!match.get().involves(playerId)) {
            return Optional.of("Player " + playerId + " is not in match " + matchId);
        }
        if (!seen.add(matchId + "_" + playerId)) {
            return Optional.of("Duplicate score for player " + playerId + " in match " + matchId);
        }
        if (store.findHandicap(playerId).isEmpty()) {
            return Optional.of("No handicap on record for player " + playerId);
        }
        if (course.holeCount() != MatchPointCalculator.HOLES_PER_MATCH) {
            return Optional.of("Course " + course.id() + " has " + course.holeCount()
                + " holes but match " + matchId + " needs " + MatchPointCalculator.HOLES_PER_MATCH);
        }
        if (!submission.absent()) {
            List<Integer> holes = submission.holeScores();
            if (holes.size() != course.holeCount()) {
                return Optional.of("Expected " + course.holeCount() + " hole scores for player " + playerId
                    + " in match " + matchId + " but got " + holes.size());
            }
            for (Integer score : holes) {
                if (score == null || score < 0) {
                    return Optional.of("Invalid hole score " + score + " for player " + playerId
                        + " in match " + matchId);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the stored card. A correction keeps the index the player carried into the
     * round the first time it was entered.
     */
    private static ScoreRecord scoreCard(LeagueStore store, MatchDay matchDay, Course course,
                                         ScoreSubmission submission) {
        double index = store.findScore(submission.matchId(), submission.playerId())
            .map(ScoreRecord::handicapIndex)
            .orElseGet(() -> store.findHandicap(submission.playerId()).orElseThrow().handicapIndex());

        CourseHandicaps handicaps = HandicapConverter.convert(index, course);
        int courseHandicap = HandicapRounding.toWhole(handicaps.courseHandicap());

        List<Integer> holeScores;
        List<Integer> adjusted;
        Optional<Double> differential;
        if (submission.absent()) {
            holeScores = AbsenceHandler.syntheticScores(handicaps.playingHandicap(), course);
            adjusted = holeScores;
            differential = Optional.empty();
        } else {
            holeScores = submission.holeScores();
            adjusted = NetDoubleBogeyAdjuster.adjust(holeScores, course, courseHandicap);
            differential = Optional.of(
                DifferentialCalculator.differential(NetDoubleBogeyAdjuster.total(adjusted), course));
        }

        return new ScoreRecord(submission.matchId(), submission.playerId(), matchDay.id(), matchDay.date(),
            course.id(), holeScores, adjusted, NetDoubleBogeyAdjuster.total(holeScores),
            NetDoubleBogeyAdjuster.total(adjusted), differential, index, courseHandicap,
            handicaps.playingHandicap(), List.of(), List.of(), submission.absent());
    }

    private static void recalculateHandicap(LeagueStore store, String playerId) {
        PlayerHandicap current = store.findHandicap(playerId).orElseThrow();
        List<Differential> differentials = store.listScoresForPlayer(playerId).stream()
            .map(ScoreRecord::asDifferential)
            .flatMap(Optional::stream)
            .toList();
        PlayerHandicap updated = HandicapIndexCalculator.recalculate(current, differentials);
        store.saveHandicap(updated);
        log.debug("Player {}: {} rounds counted, index {} -> {}", playerId, updated.roundsCounted(),
            current.handicapIndex(), updated.handicapIndex());
    }

    /**
     * Settles a match once both cards are in; empty means the other player has not scored yet.
     */
    private static Optional<MatchPoints> settleMatch(LeagueStore store, Course course, String matchId) {
        Match match = store.findMatch(matchId).orElseThrow();
        Optional<ScoreRecord> cardA = store.findScore(matchId, match.playerAId());
        Optional<ScoreRecord> cardB = store.findScore(matchId, match.playerBId());
        if (cardA.isEmpty() || cardB.isEmpty()) {
            return Optional.empty();
        }

        MatchStrokes strokes = StrokeAllocator.allocateMatch(
            match.playerAId(), cardA.get().playingHandicap(),
            match.playerBId(), cardB.get().playingHandicap(),
            course);
        List<Integer> strokesA = strokes.forPlayer(match.playerAId());
        List<Integer> strokesB = strokes.forPlayer(match.playerBId());

        MatchPoints points = MatchPointCalculator.calculate(
            cardA.get().holeScores(), cardB.get().holeScores(), strokesA, strokesB);

        store.saveScore(cardA.get().withMatchStrokes(strokesA));
        store.saveScore(cardB.get().withMatchStrokes(strokesB));
        store.saveMatch(match.withPoints(points));
        log.debug("Match {}: {} {} - {} {}", matchId, match.playerAId(), points.playerAPoints(),
            points.playerBPoints(), match.playerBId());
        return Optional.of(points);
    }

    private static boolean allMatchesScored(LeagueStore store, MatchDay matchDay) {
        List<Match> matches = store.listMatches(matchDay.id());
        if (matches.isEmpty()) {
            return false;
        }
        for (Match match : matches) {
            if (store.findScore(match.id(), match.playerAId()).isEmpty()
                || store.findScore(match.id(), match.playerBId()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static List<String> lockEarlierMatchDays(LeagueStore store, MatchDay matchDay) {
        List<String> locked = new ArrayList<>();
        for (MatchDay earlier : store.listMatchDays(matchDay.seasonId())) {
            if (!earlier.isBefore(matchDay) || earlier.status() == MatchDayStatus.LOCKED) {
                continue;
            }
            store.saveMatchDay(earlier.withStatus(MatchDayStatus.LOCKED));
            for (Match match : store.listMatches(earlier.id())) {
                store.saveMatch(match.withStatus(MatchDayStatus.LOCKED));
            }
            locked.add(earlier.id());
        }
        if (!locked.isEmpty()) {
            log.info("Locked {} earlier match days in season {}: {}", locked.size(), matchDay.seasonId(), locked);
        }
        return locked;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static MatchDay requireMatchDay(LeagueStore store, String matchDayId) {
        return store.findMatchDay(matchDayId)
            .orElseThrow(() -> new LeagueDataNotFoundException("Match day not found: " + matchDayId));
    }
}

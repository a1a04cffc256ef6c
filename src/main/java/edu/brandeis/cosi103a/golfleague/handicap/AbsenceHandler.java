package edu.brandeis.cosi103a.golfleague.handicap;

import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.Differential;
import edu.brandeis.cosi103a.golfleague.scoring.StrokeAllocator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scoring for a player who misses their match.
 *
 * <p>An absent player is credited with par plus their playing handicap plus a
 * {@value #ABSENCE_PENALTY}-stroke penalty, spread over the holes hardest first. Those
 * scores count for match points only and never produce a differential.
 */
public final class AbsenceHandler {

    public static final int ABSENCE_PENALTY = 3;
    static final double MIN_INDEX_INCREASE = 2.0;
    static final double MAX_INDEX_INCREASE = 4.0;

    private AbsenceHandler() {}

    /**
     * Synthetic hole scores: par on every hole plus the allocated strokes above par.
     * The total is always the sum of the hole pars + playingHandicap + 3.
     */
    public static List<Integer> syntheticScores(int playingHandicap, Course course) {
        int[] strokes = StrokeAllocator.allocate(playingHandicap + ABSENCE_PENALTY, course);
        List<Integer> scores = new ArrayList<>(course.holeCount());
        for (int hole = 0; hole < course.holeCount(); hole++) {
            scores.add(course.holePar(hole) + strokes[hole]);
        }
        return scores;
    }

    /**
     * Handicap index to carry for a missed round: at least posted + 2, at most posted + 4,
     * and the average of the worst three recent differentials when that falls in between.
     *
     * @param postedIndex   the player's current index
     * @param recent        the player's recent differentials; only the five most recent count,
     *                      and fewer than three leaves the +2 floor in place
     * @return adjusted index rounded to one decimal
     */
    public static double adjustedIndex(double postedIndex, List<Differential> recent) {
        double adjusted = postedIndex + MIN_INDEX_INCREASE;

        List<Differential> lastFive = HandicapIndexCalculator.mostRecent(recent);
        if (lastFive.size() >= HandicapIndexCalculator.ROUNDS_USED) {
            double worstThree = lastFive.stream()
                .map(Differential::value)
                .sorted(Comparator.reverseOrder())
                .limit(HandicapIndexCalculator.ROUNDS_USED)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(adjusted);
            adjusted = Math.max(adjusted, worstThree);
        }

        adjusted = Math.min(adjusted, postedIndex + MAX_INDEX_INCREASE);
        return HandicapRounding.toTenth(adjusted);
    }
}

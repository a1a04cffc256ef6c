package edu.brandeis.cosi103a.golfleague.scoring;

import edu.brandeis.cosi103a.golfleague.model.Course;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Caps each hole at net double bogey (par + 2 + strokes received on that hole) so one
 * blow-up hole cannot swing a handicap-earning total.
 */
public final class NetDoubleBogeyAdjuster {

    private NetDoubleBogeyAdjuster() {}

    /**
     * @param grossScores    gross score per hole, one per course hole, none negative
     * @param course         the course played
     * @param courseHandicap the player's course handicap, already rounded
     * @return adjusted score per hole
     */
    public static List<Integer> adjust(List<Integer> grossScores, Course course, int courseHandicap) {
        checkNotNull(grossScores, "grossScores");
        checkArgument(grossScores.size() == course.holeCount(),
            "Expected %s hole scores for course %s but got %s", course.holeCount(), course.id(), grossScores.size());

        int[] strokes = StrokeAllocator.allocate(courseHandicap, course);
        List<Integer> adjusted = new ArrayList<>(grossScores.size());
        for (int hole = 0; hole < grossScores.size(); hole++) {
            Integer gross = grossScores.get(hole);
            checkArgument(gross != null && gross >= 0, "Invalid score %s on hole %s", gross, hole + 1);
            adjusted.add(Math.min(gross, maxScore(course.holePar(hole), strokes[hole])));
        }
        return adjusted;
    }

    /**
     * The most a hole can count: par + 2 + strokes received.
     */
    public static int maxScore(int par, int strokesReceived) {
        return par + 2 + strokesReceived;
    }

    public static int total(List<Integer> scores) {
        int total = 0;
        for (int score : scores) {
            total += score;
        }
        return total;
    }
}

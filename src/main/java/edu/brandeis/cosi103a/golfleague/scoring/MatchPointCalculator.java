package edu.brandeis.cosi103a.golfleague.scoring;

import edu.brandeis.cosi103a.golfleague.model.MatchPoints;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Match play points for a nine-hole match, 22 in total:
 * 2 per hole to the lower net score (1-1 on a tie), and 4 to the lower net total (2-2 on a tie).
 */
public final class MatchPointCalculator {

    public static final int HOLES_PER_MATCH = 9;
    static final int POINTS_PER_HOLE = 2;
    static final int POINTS_FOR_TOTAL = 4;

    private MatchPointCalculator() {}

    /**
     * @param grossA   player A's gross score per hole
     * @param grossB   player B's gross score per hole
     * @param strokesA strokes player A receives per hole
     * @param strokesB strokes player B receives per hole
     */
    public static MatchPoints calculate(List<Integer> grossA, List<Integer> grossB,
                                        List<Integer> strokesA, List<Integer> strokesB) {
        checkHoles(grossA, "player A scores");
        checkHoles(grossB, "player B scores");
        checkHoles(strokesA, "player A strokes");
        checkHoles(strokesB, "player B strokes");

        int pointsA = 0;
        int pointsB = 0;
        int totalNetA = 0;
        int totalNetB = 0;

        for (int hole = 0; hole < HOLES_PER_MATCH; hole++) {
            int netA = grossA.get(hole) - strokesA.get(hole);
            int netB = grossB.get(hole) - strokesB.get(hole);
            totalNetA += netA;
            totalNetB += netB;

            if (netA < netB) {
                pointsA += POINTS_PER_HOLE;
            } else if (netB < netA) {
                pointsB += POINTS_PER_HOLE;
            } else {
                pointsA += POINTS_PER_HOLE / 2;
                pointsB += POINTS_PER_HOLE / 2;
            }
        }

        if (totalNetA < totalNetB) {
            pointsA += POINTS_FOR_TOTAL;
        } else if (totalNetB < totalNetA) {
            pointsB += POINTS_FOR_TOTAL;
        } else {
            pointsA += POINTS_FOR_TOTAL / 2;
            pointsB += POINTS_FOR_TOTAL / 2;
        }

        return new MatchPoints(pointsA, pointsB);
    }

    private static void checkHoles(List<Integer> values, String what) {
        checkNotNull(values, what);
        checkArgument(values.size() == HOLES_PER_MATCH,
            "Expected %s values for %s but got %s", HOLES_PER_MATCH, what, values.size());
        for (Integer value : values) {
            checkArgument(value != null, "Missing value in %s", what);
        }
    }
}

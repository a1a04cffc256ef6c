package edu.brandeis.cosi103a.golfleague.scoring;

import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.MatchStrokes;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Distributes whole strokes over the holes of a course, hardest hole (stroke index 1) first.
 *
 * <p>Once every hole has a stroke the next one goes back to stroke index 1, so S strokes on an
 * N-hole course give every hole S / N strokes and the S mod N hardest holes one more.
 * A negative count takes strokes away starting from the easiest hole.
 */
public final class StrokeAllocator {

    private StrokeAllocator() {}

    /**
     * Strokes received on a single hole for a given total.
     *
     * @param totalStrokes strokes to distribute over the whole course
     * @param strokeIndex  the hole's stroke index (1 is hardest)
     * @param holeCount    number of holes on the course
     */
    public static int strokesForHole(int totalStrokes, int strokeIndex, int holeCount) {
        checkArgument(holeCount > 0, "Hole count must be positive: %s", holeCount);
        int base = Math.floorDiv(totalStrokes, holeCount);
        int remainder = Math.floorMod(totalStrokes, holeCount);
        return base + (strokeIndex <= remainder ? 1 : 0);
    }

    /**
     * Per-hole strokes for a total, indexed by hole position on the course.
     */
    public static int[] allocate(int totalStrokes, Course course) {
        int holes = course.holeCount();
        int[] strokes = new int[holes];
        for (int hole = 0; hole < holes; hole++) {
            strokes[hole] = strokesForHole(totalStrokes, course.strokeIndex(hole), holes);
        }
        return strokes;
    }

    /**
     * Strokes for a match. Only the player with the higher playing handicap receives strokes,
     * as many as the difference between the two; the other player gets zeros.
     */
    public static MatchStrokes allocateMatch(String playerAId, int playingHandicapA,
                                             String playerBId, int playingHandicapB,
                                             Course course) {
        checkArgument(!playerAId.equals(playerBId), "Players must differ: %s", playerAId);

        int difference = playingHandicapA - playingHandicapB;
        int[] none = new int[course.holeCount()];
        int[] received = difference == 0 ? none : allocate(Math.abs(difference), course);

        Map<String, List<Integer>> result = new LinkedHashMap<>();
        result.put(playerAId, toList(difference > 0 ? received : none));
        result.put(playerBId, toList(difference < 0 ? received : none));
        return new MatchStrokes(result);
    }

    private static List<Integer> toList(int[] strokes) {
        return Arrays.stream(strokes).boxed().toList();
    }
}

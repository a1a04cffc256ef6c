package edu.brandeis.cosi103a.golfleague.scoring;

import edu.brandeis.cosi103a.golfleague.LeagueFixtures;
import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.MatchStrokes;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StrokeAllocatorTest {

    private final Course course = LeagueFixtures.oakHills();

    @Test
    void zeroStrokes_allZeros() {
        assertArrayEquals(new int[9], StrokeAllocator.allocate(0, course));
    }

    @Test
    void fewerThanHoles_goToHardestHoles() {
        // stroke indices 1, 2 and 3 sit on holes 1, 5 and 3
        assertArrayEquals(new int[] {1, 0, 1, 0, 1, 0, 0, 0, 0}, StrokeAllocator.allocate(3, course));
    }

    @Test
    void moreThanHoles_wrapsAroundFromIndexOne() {
        assertArrayEquals(new int[] {2, 1, 1, 1, 2, 1, 1, 1, 1}, StrokeAllocator.allocate(11, course));
    }

    @Test
    void negativeStrokes_comeOffEasiestHoles() {
        // stroke indices 9 and 8 sit on holes 6 and 9
        assertArrayEquals(new int[] {0, 0, 0, 0, 0, -1, 0, 0, -1}, StrokeAllocator.allocate(-2, course));
    }

    @Test
    void allocation_sumsToTotalAndFavoursHarderHoles() {
        for (int total = -12; total <= 40; total++) {
            int[] strokes = StrokeAllocator.allocate(total, course);
            assertEquals(total, Arrays.stream(strokes).sum(), "total " + total);

            for (int a = 0; a < strokes.length; a++) {
                for (int b = 0; b < strokes.length; b++) {
                    if (course.strokeIndex(a) < course.strokeIndex(b)) {
                        assertTrue(strokes[a] >= strokes[b], "total " + total + " holes " + a + "," + b);
                    }
                }
            }
        }
    }

    @Test
    void strokesForHole_matchesAllocate() {
        assertEquals(2, StrokeAllocator.strokesForHole(11, 1, 9));
        assertEquals(1, StrokeAllocator.strokesForHole(11, 3, 9));
        assertEquals(-1, StrokeAllocator.strokesForHole(-2, 8, 9));
    }

    @Test
    void match_higherHandicapReceivesDifference() {
        MatchStrokes strokes = StrokeAllocator.allocateMatch("alice", 12, "bob", 7, course);

        assertEquals(List.of(1, 0, 1, 1, 1, 0, 1, 0, 0), strokes.forPlayer("alice"));
        assertEquals(List.of(0, 0, 0, 0, 0, 0, 0, 0, 0), strokes.forPlayer("bob"));
        assertEquals(Optional.of("alice"), strokes.receivingPlayer());
    }

    @Test
    void match_playerBCanReceive() {
        MatchStrokes strokes = StrokeAllocator.allocateMatch("alice", 2, "bob", 12, course);

        assertEquals(List.of(2, 1, 1, 1, 1, 1, 1, 1, 1), strokes.forPlayer("bob"));
        assertEquals(0, strokes.forPlayer("alice").stream().mapToInt(Integer::intValue).sum());
        assertEquals(Optional.of("bob"), strokes.receivingPlayer());
    }

    @Test
    void match_equalHandicaps_noStrokes() {
        MatchStrokes strokes = StrokeAllocator.allocateMatch("alice", 9, "bob", 9, course);

        assertTrue(strokes.receivingPlayer().isEmpty());
        assertEquals(0, strokes.forPlayer("alice").stream().mapToInt(Integer::intValue).sum());
        assertEquals(0, strokes.forPlayer("bob").stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void match_plusHandicapOpponent() {
        MatchStrokes strokes = StrokeAllocator.allocateMatch("alice", -2, "bob", 1, course);
        assertEquals(3, strokes.forPlayer("bob").stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void forPlayer_unknownPlayerRejected() {
        MatchStrokes strokes = StrokeAllocator.allocateMatch("alice", 3, "bob", 1, course);
        assertThrows(IllegalArgumentException.class, () -> strokes.forPlayer("carol"));
    }
}

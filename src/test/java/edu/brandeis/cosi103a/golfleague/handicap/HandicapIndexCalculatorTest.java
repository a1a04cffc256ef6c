package edu.brandeis.cosi103a.golfleague.handicap;

import edu.brandeis.cosi103a.golfleague.model.Differential;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers each round-count branch of the league handicap formula.
 */
class HandicapIndexCalculatorTest {

    private static final double TOLERANCE = 1e-9;
    private static final LocalDate START = LocalDate.of(2025, 5, 1);

    /** Differentials one week apart, oldest first. */
    private static List<Differential> weekly(double... values) {
        List<Differential> result = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            result.add(new Differential(values[i], START.plusWeeks(i)));
        }
        return result;
    }

    @Test
    void noRounds_usesProvisionalExactly() {
        assertEquals(12.4, HandicapIndexCalculator.calculate(List.of(), 12.4), TOLERANCE);
    }

    @Test
    void oneRound_weightsProvisionalTwice() {
        // ((2 x 11.7) + 12.3) / 3 = 11.9
        assertEquals(11.9, HandicapIndexCalculator.calculate(weekly(12.3), 11.7), TOLERANCE);
    }

    @Test
    void twoRounds_averageWithProvisional() {
        assertEquals(13.0, HandicapIndexCalculator.calculate(weekly(13.0, 16.0), 10.0), TOLERANCE);
    }

    @Test
    void threeRounds_ignoreProvisional() {
        assertEquals(12.0, HandicapIndexCalculator.calculate(weekly(10.0, 12.0, 14.0), 30.0), TOLERANCE);
    }

    @Test
    void fourRounds_averageAllAndRoundHalfUp() {
        // 47 / 4 = 11.75
        assertEquals(11.8, HandicapIndexCalculator.calculate(weekly(10.0, 11.0, 12.0, 14.0), 0.0), TOLERANCE);
    }

    @Test
    void fiveRounds_averageBestThree() {
        // best three: 8.3, 9.1, 10.0 -> 9.133
        assertEquals(9.1, HandicapIndexCalculator.calculate(weekly(9.1, 15.0, 8.3, 20.2, 10.0), 0.0), TOLERANCE);
    }

    @Test
    void fifthRound_dropsTheTwoWorst() {
        List<Differential> four = weekly(10.0, 11.0, 12.0, 20.0);
        List<Differential> five = weekly(10.0, 11.0, 12.0, 20.0, 30.0);

        assertEquals(13.3, HandicapIndexCalculator.calculate(four, 0.0), TOLERANCE);
        assertEquals(11.0, HandicapIndexCalculator.calculate(five, 0.0), TOLERANCE);
    }

    @Test
    void moreThanFive_onlyMostRecentFiveCount() {
        // The oldest round (0.0) would pull the index down to 7.0 if it counted
        List<Differential> six = weekly(0.0, 10.0, 11.0, 12.0, 13.0, 14.0);
        assertEquals(11.0, HandicapIndexCalculator.calculate(six, 0.0), TOLERANCE);
    }

    @Test
    void fiveRounds_independentOfInputOrder() {
        List<Differential> differentials = weekly(9.1, 15.0, 8.3, 20.2, 10.0);
        double expected = HandicapIndexCalculator.calculate(differentials, 0.0);

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            List<Differential> shuffled = new ArrayList<>(differentials);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, HandicapIndexCalculator.calculate(shuffled, 0.0), TOLERANCE);
        }
    }

    @Test
    void calculate_isDeterministic() {
        List<Differential> differentials = weekly(14.2, 9.8, 11.1);
        double first = HandicapIndexCalculator.calculate(differentials, 12.0);
        double second = HandicapIndexCalculator.calculate(differentials, 12.0);
        assertEquals(first, second);
    }

    @Test
    void recalculate_tracksRoundsAndEstablishedStatus() {
        PlayerHandicap seed = PlayerHandicap.provisional("alice", 10.0);

        PlayerHandicap afterTwo = HandicapIndexCalculator.recalculate(seed, weekly(13.0, 16.0));
        assertEquals(2, afterTwo.roundsCounted());
        assertFalse(afterTwo.established());
        assertEquals(13.0, afterTwo.handicapIndex(), TOLERANCE);
        assertEquals(10.0, afterTwo.provisionalHandicap(), TOLERANCE);

        PlayerHandicap afterSix = HandicapIndexCalculator.recalculate(seed,
            weekly(0.0, 10.0, 11.0, 12.0, 13.0, 14.0));
        assertEquals(5, afterSix.roundsCounted());
        assertTrue(afterSix.established());
    }

    @Test
    void isEstablished_atFiveRounds() {
        assertFalse(HandicapIndexCalculator.isEstablished(4));
        assertTrue(HandicapIndexCalculator.isEstablished(5));
    }
}

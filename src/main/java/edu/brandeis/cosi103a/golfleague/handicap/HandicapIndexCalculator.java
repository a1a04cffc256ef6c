package edu.brandeis.cosi103a.golfleague.handicap;

import edu.brandeis.cosi103a.golfleague.model.Differential;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * League handicap index from a player's recent differentials.
 *
 * <p>The formula depends on how many differentials are available:
 * <ul>
 *   <li>0: the provisional handicap</li>
 *   <li>1: (2 * provisional + d1) / 3</li>
 *   <li>2: (provisional + d1 + d2) / 3</li>
 *   <li>3 or 4: mean of all of them</li>
 *   <li>5: mean of the lowest 3</li>
 * </ul>
 * Only the five most recent differentials are ever considered. The result is rounded to
 * one decimal place.
 */
public final class HandicapIndexCalculator {

    public static final int ROUNDS_CONSIDERED = 5;
    public static final int ROUNDS_USED = 3;

    private HandicapIndexCalculator() {}

    /**
     * Compute the league handicap index.
     *
     * @param differentials non-absent differentials in any order; anything beyond the five most recent is ignored
     * @param provisional   seed handicap assigned at enrollment
     * @return index rounded to one decimal
     */
    public static double calculate(List<Differential> differentials, double provisional) {
        List<Double> values = mostRecent(differentials).stream().map(Differential::value).toList();

        double index = switch (values.size()) {
            case 0 -> provisional;
            case 1 -> (2 * provisional + values.get(0)) / 3;
            case 2 -> (provisional + values.get(0) + values.get(1)) / 3;
            case 3, 4 -> mean(values);
            default -> mean(values.stream().sorted().limit(ROUNDS_USED).toList());
        };
        return HandicapRounding.toTenth(index);
    }

    /**
     * Recompute a player's handicap state from their qualifying differentials.
     * The provisional seed is carried over unchanged.
     */
    public static PlayerHandicap recalculate(PlayerHandicap current, List<Differential> differentials) {
        int counted = mostRecent(differentials).size();
        double index = calculate(differentials, current.provisionalHandicap());
        return new PlayerHandicap(current.playerId(), current.provisionalHandicap(), index, counted,
            isEstablished(counted));
    }

    /**
     * Established players have at least five qualifying scores. Display only; the
     * formula does not depend on it.
     */
    public static boolean isEstablished(int qualifyingRounds) {
        return qualifyingRounds >= ROUNDS_CONSIDERED;
    }

    /**
     * The five most recent differentials, newest first. Equal dates keep their supplied order.
     */
    static List<Differential> mostRecent(List<Differential> differentials) {
        checkNotNull(differentials, "differentials");
        List<Differential> sorted = new ArrayList<>(differentials);
        sorted.sort(Comparator.comparing(Differential::date, Comparator.nullsLast(Comparator.reverseOrder())));
        return sorted.size() > ROUNDS_CONSIDERED ? sorted.subList(0, ROUNDS_CONSIDERED) : sorted;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}

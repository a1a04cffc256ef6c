package edu.brandeis.cosi103a.golfleague.handicap;

import edu.brandeis.cosi103a.golfleague.model.Course;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Converts an adjusted gross total into a course-independent score differential.
 */
public final class DifferentialCalculator {

    /** Slope of a course of standard difficulty. */
    public static final int STANDARD_SLOPE = 113;

    private DifferentialCalculator() {}

    /**
     * (adjustedGross - courseRating) * 113 / slopeRating
     *
     * @throws IllegalArgumentException if the slope is not positive
     */
    public static double differential(int adjustedGross, double courseRating, int slopeRating) {
        checkArgument(slopeRating > 0, "Slope rating must be positive: %s", slopeRating);
        return (adjustedGross - courseRating) * STANDARD_SLOPE / slopeRating;
    }

    public static double differential(int adjustedGross, Course course) {
        return differential(adjustedGross, course.courseRating(), course.slopeRating());
    }
}

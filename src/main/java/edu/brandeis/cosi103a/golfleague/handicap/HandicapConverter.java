package edu.brandeis.cosi103a.golfleague.handicap;

import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.CourseHandicaps;

/**
 * Scales a handicap index to a specific course.
 */
public final class HandicapConverter {

    /** Share of the course handicap applied in match play. */
    public static final double PLAYING_ALLOWANCE = 0.95;

    private HandicapConverter() {}

    /**
     * (index * slope / 113) + (courseRating - par), left unrounded.
     */
    public static double courseHandicap(double handicapIndex, Course course) {
        return (handicapIndex * course.slopeRating() / DifferentialCalculator.STANDARD_SLOPE)
            + (course.courseRating() - course.par());
    }

    /**
     * The course handicap after the 95% allowance, rounded half away from zero.
     */
    public static int playingHandicap(double courseHandicap) {
        return HandicapRounding.toWhole(courseHandicap * PLAYING_ALLOWANCE);
    }

    public static CourseHandicaps convert(double handicapIndex, Course course) {
        double courseHandicap = courseHandicap(handicapIndex, course);
        return new CourseHandicaps(courseHandicap, playingHandicap(courseHandicap));
    }
}

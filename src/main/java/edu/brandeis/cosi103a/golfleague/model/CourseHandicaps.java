package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A handicap index converted for one course.
 *
 * @param courseHandicap  unrounded course handicap
 * @param playingHandicap course handicap after the allowance, rounded
 */
public record CourseHandicaps(
    @JsonProperty("courseHandicap") double courseHandicap,
    @JsonProperty("playingHandicap") int playingHandicap
) {}

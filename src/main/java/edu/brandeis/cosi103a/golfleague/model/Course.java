package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A course as the scoring engine sees it: per-hole pars and stroke indices plus the
 * rating and slope used for handicap conversion.
 *
 * @param id             course identifier
 * @param name           display name
 * @param par            overall par
 * @param courseRating   course rating
 * @param slopeRating    slope rating, must be positive
 * @param holePars       par for each hole
 * @param strokeIndices  difficulty ranking per hole, a permutation of 1..N (1 is hardest)
 */
public record Course(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("par") int par,
    @JsonProperty("courseRating") double courseRating,
    @JsonProperty("slopeRating") int slopeRating,
    @JsonProperty("holePars") List<Integer> holePars,
    @JsonProperty("strokeIndices") List<Integer> strokeIndices
) {
    public Course {
        checkNotNull(id, "course id");
        checkNotNull(holePars, "holePars for course %s", id);
        checkNotNull(strokeIndices, "strokeIndices for course %s", id);
        checkArgument(slopeRating > 0, "Slope rating must be positive for course %s: %s", id, slopeRating);
        checkArgument(!holePars.isEmpty(), "Course %s has no holes", id);
        checkArgument(holePars.size() == strokeIndices.size(),
            "Course %s has %s hole pars but %s stroke indices", id, holePars.size(), strokeIndices.size());

        Set<Integer> seen = new HashSet<>();
        for (Integer index : strokeIndices) {
            checkArgument(index != null && index >= 1 && index <= strokeIndices.size(),
                "Stroke index %s out of range 1..%s for course %s", index, strokeIndices.size(), id);
            checkArgument(seen.add(index), "Duplicate stroke index %s for course %s", index, id);
        }
        for (Integer holePar : holePars) {
            checkArgument(holePar != null && holePar > 0, "Invalid hole par %s for course %s", holePar, id);
        }

        holePars = ImmutableList.copyOf(holePars);
        strokeIndices = ImmutableList.copyOf(strokeIndices);
    }

    @JsonIgnore
    public int holeCount() {
        return holePars.size();
    }

    public int holePar(int hole) {
        return holePars.get(hole);
    }

    public int strokeIndex(int hole) {
        return strokeIndices.get(hole);
    }

    /**
     * Sum of the per-hole pars. Usually equal to {@link #par()}, but absent-player
     * scoring is defined against the holes themselves.
     */
    @JsonIgnore
    public int totalHolePar() {
        int total = 0;
        for (int holePar : holePars) {
            total += holePar;
        }
        return total;
    }
}

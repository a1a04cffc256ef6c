package edu.brandeis.cosi103a.golfleague.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A score differential and the date of the round that earned it.
 */
public record Differential(
    @JsonProperty("value") double value,
    @JsonProperty("date") LocalDate date
) {}

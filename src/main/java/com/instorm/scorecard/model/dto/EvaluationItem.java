package com.instorm.scorecard.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single scored behavior within an evaluation. The API names the score {@code rating}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationItem(@JsonAlias("rating") double score) {}

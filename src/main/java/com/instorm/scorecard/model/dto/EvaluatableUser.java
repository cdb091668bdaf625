package com.instorm.scorecard.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Entry of {@code GET /organizations/salespeople}. Only read by diagnostics.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluatableUser(String id, String displayName, String role) {}

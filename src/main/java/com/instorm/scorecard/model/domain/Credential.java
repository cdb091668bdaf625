package com.instorm.scorecard.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bearer token together with the user it authorizes. This is the only state the
 * client persists between runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credential(String token, User user) {

    @JsonIgnore
    public boolean isStructurallyValid() {
        return token != null && !token.isBlank() && user != null && user.isComplete();
    }

    @Override
    public String toString() {
        return "Credential{user=" + user + ", token=***}";
    }
}

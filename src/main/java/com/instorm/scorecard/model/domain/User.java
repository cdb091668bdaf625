package com.instorm.scorecard.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The authenticated user. Immutable for the lifetime of a session: a different
 * role only ever arrives with a new login.
 *
 * @param role raw role code as sent by the API, see {@link Role}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
    String id,
    String email,
    String displayName,
    String role
) {

    @JsonIgnore
    public boolean hasRole(Role expected) {
        return expected.matches(role);
    }

    @JsonIgnore
    public boolean isComplete() {
        return id != null && !id.isBlank() && role != null && !role.isBlank();
    }
}

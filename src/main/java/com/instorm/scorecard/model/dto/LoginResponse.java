package com.instorm.scorecard.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.instorm.scorecard.model.domain.User;

/**
 * Response of {@code POST /auth/login}. Older API deployments send snake_case token fields.
 * Refresh tokens are ignored; an expired session ends with a new login.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginResponse(
    @JsonAlias("access_token") String token,
    @JsonAlias("expires_in") Long expiresIn,
    User user
) {

    @Override
    public String toString() {
        return "LoginResponse{user=" + user + ", expiresIn=" + expiresIn + "}";
    }
}

package com.instorm.scorecard.client;

import com.instorm.scorecard.model.dto.DirectorateMetrics;
import com.instorm.scorecard.model.dto.EvaluatableUser;
import com.instorm.scorecard.model.dto.EvaluationRecord;
import com.instorm.scorecard.model.dto.LoginResponse;

import java.util.List;

/**
 * Interface for Scorecard API operations.
 * Allows swapping between mock and production implementations.
 */
public interface ScorecardApiClient {

    /**
     * Exchanges user credentials for a bearer token.
     *
     * @throws com.instorm.scorecard.exception.AuthException on rejected credentials or a network fault
     */
    LoginResponse authenticate(String identifier, String secret);

    /**
     * Pre-aggregated roll-up for the whole directorate.
     *
     * @throws com.instorm.scorecard.exception.ApiException on a network or shape fault
     * @throws com.instorm.scorecard.exception.AuthException when the token is no longer accepted
     */
    DirectorateMetrics fetchDirectorateSummary();

    /**
     * Evaluations where the current user is the evaluated salesperson, in API order.
     */
    List<EvaluationRecord> fetchOwnEvaluations();

    /**
     * Users the current user is allowed to evaluate. Only used by diagnostics.
     */
    List<EvaluatableUser> fetchEvaluatableUsers();
}

package com.instorm.scorecard.client.impl.production;

import com.instorm.scorecard.client.ScorecardApiClient;
import com.instorm.scorecard.exception.ApiException;
import com.instorm.scorecard.exception.AuthException;
import com.instorm.scorecard.model.dto.DirectorateMetrics;
import com.instorm.scorecard.model.dto.EvaluatableUser;
import com.instorm.scorecard.model.dto.EvaluationRecord;
import com.instorm.scorecard.model.dto.LoginRequest;
import com.instorm.scorecard.model.dto.LoginResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@Profile("!mock")
public class ProductionScorecardApiClient implements ScorecardApiClient {

    static final String LOGIN_PATH = "/auth/login";
    static final String DIRECTORATE_PATH = "/analytics/dashboard";
    static final String OWN_EVALUATIONS_PATH = "/evaluations/my";
    static final String EVALUATABLE_USERS_PATH = "/organizations/salespeople";

    private final RestTemplate restTemplate;

    public ProductionScorecardApiClient(@Qualifier("scorecardRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public LoginResponse authenticate(String identifier, String secret) {
        log.info("Authenticating '{}' against Scorecard API...", identifier);
        try {
            ResponseEntity<LoginResponse> response = restTemplate.postForEntity(
                    LOGIN_PATH, new LoginRequest(identifier, secret), LoginResponse.class);
            LoginResponse body = response.getBody();
            if (body == null) {
                throw new AuthException("Login failed: empty response from server");
            }
            return body;
        } catch (HttpStatusCodeException e) {
            log.warn("Login rejected for '{}': {}", identifier, e.getStatusCode());
            throw new AuthException("Login failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            log.error("Login call for '{}' failed: {}", identifier, e.getMessage());
            throw new AuthException("Login failed", e);
        }
    }

    @Override
    public DirectorateMetrics fetchDirectorateSummary() {
        log.info("Fetching directorate summary from Scorecard API...");
        ResponseEntity<DirectorateMetrics> response = exchange(DIRECTORATE_PATH, new ParameterizedTypeReference<DirectorateMetrics>() {});
        DirectorateMetrics body = response.getBody();
        if (body == null) {
            throw new ApiException("Empty directorate summary from " + DIRECTORATE_PATH, response.getStatusCode().value(), null);
        }
        return body;
    }

    @Override
    public List<EvaluationRecord> fetchOwnEvaluations() {
        log.info("Fetching own evaluations from Scorecard API...");
        List<EvaluationRecord> evaluations = requireList(
                OWN_EVALUATIONS_PATH, exchange(OWN_EVALUATIONS_PATH, new ParameterizedTypeReference<List<EvaluationRecord>>() {}));
        log.info("Successfully retrieved {} evaluations.", evaluations.size());
        return evaluations;
    }

    @Override
    public List<EvaluatableUser> fetchEvaluatableUsers() {
        log.debug("Fetching evaluatable users from Scorecard API...");
        return requireList(
                EVALUATABLE_USERS_PATH, exchange(EVALUATABLE_USERS_PATH, new ParameterizedTypeReference<List<EvaluatableUser>>() {}));
    }

    private <T> ResponseEntity<T> exchange(String path, ParameterizedTypeReference<T> type) {
        try {
            return restTemplate.exchange(path, HttpMethod.GET, null, type);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                log.warn("Scorecard API rejected the session token on {}", path);
                throw new AuthException("Authentication expired. Please log in again.", e);
            }
            log.error("Scorecard API error on {}: {} - {}", path, e.getStatusCode(), e.getResponseBodyAsString());
            throw new ApiException("API Error: " + e.getStatusCode().value() + " on " + path, e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            // Also covers bodies Jackson cannot bind to the expected records
            log.error("Scorecard API call to {} failed: {}", path, e.getMessage());
            throw new ApiException("Request to " + path + " failed", e);
        }
    }

    private static <E> List<E> requireList(String path, ResponseEntity<List<E>> response) {
        List<E> body = response.getBody();
        if (body == null) {
            throw new ApiException("Empty response from " + path, response.getStatusCode().value(), null);
        }
        if (body.stream().anyMatch(Objects::isNull)) {
            throw new ApiException("Malformed response from " + path + ": null element", response.getStatusCode().value(), null);
        }
        return body;
    }
}

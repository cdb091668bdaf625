package com.instorm.scorecard.client.impl;

import com.instorm.scorecard.client.ScorecardApiClient;
import com.instorm.scorecard.exception.AuthException;
import com.instorm.scorecard.model.domain.Role;
import com.instorm.scorecard.model.domain.User;
import com.instorm.scorecard.model.dto.DirectorateMetrics;
import com.instorm.scorecard.model.dto.EvaluatableUser;
import com.instorm.scorecard.model.dto.EvaluationItem;
import com.instorm.scorecard.model.dto.EvaluationRecord;
import com.instorm.scorecard.model.dto.LoginResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Canned Scorecard API for running the client without a backend. Any known email
 * logs in with the password {@value #MOCK_PASSWORD}.
 */
@Slf4j
@Service
@Profile("mock")
public class MockScorecardApiClient implements ScorecardApiClient {

    static final String MOCK_PASSWORD = "scorecard";

    private static final Map<String, User> USERS = Map.of(
            "director@instorm.io", new User("u-100", "director@instorm.io", "Diana Director", Role.SALES_DIRECTOR.name()),
            "manager@instorm.io", new User("u-200", "manager@instorm.io", "Marco Manager", Role.REGIONAL_SALES_MANAGER.name()),
            "lead@instorm.io", new User("u-300", "lead@instorm.io", "Lena Lead", Role.SALES_LEAD.name()),
            "sales@instorm.io", new User("u-400", "sales@instorm.io", "Sam Seller", Role.SALESPERSON.name())
    );

    private final Clock clock;
    private final AtomicInteger callCount = new AtomicInteger(0);

    public MockScorecardApiClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LoginResponse authenticate(String identifier, String secret) {
        log.info("MOCK SCORECARD API CALL #{} - LOGIN {}", callCount.incrementAndGet(), identifier);
        User user = identifier != null ? USERS.get(identifier.toLowerCase()) : null;
        if (user == null || !MOCK_PASSWORD.equals(secret)) {
            throw new AuthException("Login failed: 401 Invalid credentials");
        }
        return new LoginResponse("mock." + UUID.randomUUID() + ".token", 3600L, user);
    }

    @Override
    public DirectorateMetrics fetchDirectorateSummary() {
        log.info("MOCK SCORECARD API CALL #{} - DIRECTORATE SUMMARY", callCount.incrementAndGet());
        return new DirectorateMetrics(5, 45, 87.0, 156, 23, 4.2);
    }

    @Override
    public List<EvaluationRecord> fetchOwnEvaluations() {
        log.info("MOCK SCORECARD API CALL #{} - OWN EVALUATIONS", callCount.incrementAndGet());
        LocalDate today = LocalDate.now(clock);
        return List.of(
                new EvaluationRecord("e-1", today, List.of(new EvaluationItem(4), new EvaluationItem(5))),
                new EvaluationRecord("e-2", today.minusMonths(1), List.of(new EvaluationItem(3), new EvaluationItem(4))),
                new EvaluationRecord("e-3", today.minusMonths(2), List.of())
        );
    }

    @Override
    public List<EvaluatableUser> fetchEvaluatableUsers() {
        log.info("MOCK SCORECARD API CALL #{} - EVALUATABLE USERS", callCount.incrementAndGet());
        return USERS.values().stream()
                .filter(user -> user.hasRole(Role.SALESPERSON))
                .map(user -> new EvaluatableUser(user.id(), user.displayName(), user.role()))
                .toList();
    }
}

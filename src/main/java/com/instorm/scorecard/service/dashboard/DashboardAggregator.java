package com.instorm.scorecard.service.dashboard;

import com.instorm.scorecard.client.ScorecardApiClient;
import com.instorm.scorecard.exception.AuthException;
import com.instorm.scorecard.model.domain.Role;
import com.instorm.scorecard.model.domain.User;
import com.instorm.scorecard.model.dto.DirectorateMetrics;
import com.instorm.scorecard.model.dto.EvaluationRecord;
import com.instorm.scorecard.model.dto.IndividualMetrics;
import com.instorm.scorecard.session.SessionListener;
import com.instorm.scorecard.session.SessionManager;
import com.instorm.scorecard.session.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the dashboard metrics in step with the current user's role.
 *
 * Flow per role change: LOADING -> fetch (directorate roll-up for sales directors,
 * own evaluations for everyone else) -> reduce -> READY, or FAILED with zeroed
 * metrics. Only a change of role starts a new load.
 *
 * Every load is tagged with a generation number. A result whose generation has been
 * superseded by a newer role change or a logout is dropped, together with its side
 * effects: a stale 401 never ends the session that replaced it.
 */
@Slf4j
@Service
public class DashboardAggregator implements SessionListener {

    private final ScorecardApiClient apiClient;
    private final SessionManager sessionManager;
    private final SessionState sessionState;
    private final EvaluationMetricsCalculator metricsCalculator;
    private final Executor executor;
    private final Counter loadFailedCounter;

    private final AtomicLong generation = new AtomicLong();
    private DashboardSnapshot current = DashboardSnapshot.loading(null);
    private CompletableFuture<DashboardSnapshot> currentLoad = CompletableFuture.completedFuture(current);
    private String observedRole;

    public DashboardAggregator(ScorecardApiClient apiClient,
                               SessionManager sessionManager,
                               SessionState sessionState,
                               EvaluationMetricsCalculator metricsCalculator,
                               @Qualifier("dashboardExecutor") Executor executor,
                               MeterRegistry meterRegistry) {
        this.apiClient = apiClient;
        this.sessionManager = sessionManager;
        this.sessionState = sessionState;
        this.metricsCalculator = metricsCalculator;
        this.executor = executor;
        this.loadFailedCounter = meterRegistry.counter("scorecard.dashboard.load.failed");
    }

    @PostConstruct
    public void register() {
        sessionState.addListener(this);
        sessionState.currentUser().ifPresent(user -> onSessionChanged(Optional.of(user)));
    }

    @PreDestroy
    public void unregister() {
        sessionState.removeListener(this);
    }

    @Override
    public synchronized void onSessionChanged(Optional<User> user) {
        if (user.isEmpty()) {
            generation.incrementAndGet();
            observedRole = null;
            current = DashboardSnapshot.loading(null);
            currentLoad = CompletableFuture.completedFuture(current);
            return;
        }
        String role = user.get().role();
        if (Objects.equals(role, observedRole)) {
            return;
        }
        observedRole = role;
        currentLoad = load(role);
    }

    public synchronized DashboardSnapshot current() {
        return current;
    }

    /**
     * The load started by the most recent role change. Completes with the snapshot
     * that load produced, or with the newer snapshot if the load went stale.
     */
    public synchronized CompletableFuture<DashboardSnapshot> currentLoad() {
        return currentLoad;
    }

    private CompletableFuture<DashboardSnapshot> load(String role) {
        long loadGeneration = generation.incrementAndGet();
        current = DashboardSnapshot.loading(role);
        log.info("Loading dashboard for role {} (generation {})", role, loadGeneration);
        return CompletableFuture
                .supplyAsync(() -> fetchAndReduce(role), executor)
                .thenApply(outcome -> apply(loadGeneration, outcome));
    }

    private synchronized DashboardSnapshot apply(long loadGeneration, LoadOutcome outcome) {
        DashboardSnapshot snapshot = outcome.snapshot();
        if (generation.get() != loadGeneration) {
            log.debug("Discarding stale dashboard result for role {} (generation {}, current {})",
                    snapshot.role(), loadGeneration, generation.get());
            return current;
        }
        current = snapshot;
        log.info("Dashboard for role {} is {}", snapshot.role(), snapshot.status());
        if (outcome.authFailure() != null) {
            invalidateSession(outcome.authFailure());
        }
        return snapshot;
    }

    private void invalidateSession(AuthException failure) {
        try {
            sessionManager.invalidate(failure.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to invalidate session after rejected dashboard load", e);
        }
    }

    private LoadOutcome fetchAndReduce(String role) {
        try {
            if (Role.SALES_DIRECTOR.matches(role)) {
                DirectorateMetrics summary = apiClient.fetchDirectorateSummary();
                return new LoadOutcome(DashboardSnapshot.ready(role, summary), null);
            }
            List<EvaluationRecord> evaluations = apiClient.fetchOwnEvaluations();
            IndividualMetrics metrics = metricsCalculator.calculate(evaluations);
            return new LoadOutcome(DashboardSnapshot.ready(role, metrics), null);
        } catch (AuthException e) {
            loadFailedCounter.increment();
            log.warn("Dashboard load for role {} was not authorized: {}", role, e.getMessage());
            return new LoadOutcome(DashboardSnapshot.failed(role), e);
        } catch (RuntimeException e) {
            loadFailedCounter.increment();
            log.error("Failed to load dashboard data for role {}", role, e);
            return new LoadOutcome(DashboardSnapshot.failed(role), null);
        }
    }

    /**
     * Result of one fetch. The session is only invalidated once the outcome is known to be current.
     */
    private record LoadOutcome(DashboardSnapshot snapshot, AuthException authFailure) {
    }
}

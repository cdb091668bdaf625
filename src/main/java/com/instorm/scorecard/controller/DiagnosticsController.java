package com.instorm.scorecard.controller;

import com.instorm.scorecard.client.ScorecardApiClient;
import com.instorm.scorecard.model.domain.Role;
import com.instorm.scorecard.model.domain.User;
import com.instorm.scorecard.service.dashboard.DashboardSnapshot;
import com.instorm.scorecard.model.dto.EvaluatableUser;
import com.instorm.scorecard.service.dashboard.DashboardAggregator;
import com.instorm.scorecard.session.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Internal read-only view of the client's session and dashboard state.
 * Kept for debugging on devices; it never changes session or dashboard state.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
public class DiagnosticsController {

    private final SessionState sessionState;
    private final DashboardAggregator dashboardAggregator;
    private final ScorecardApiClient apiClient;

    public record SessionView(boolean authenticated, User user, String roleLabel, DashboardSnapshot dashboard) {}

    @GetMapping("/session")
    public SessionView session() {
        User user = sessionState.currentUser().orElse(null);
        String roleLabel = user != null ? Role.displayLabel(user.role()) : null;
        return new SessionView(user != null, user, roleLabel, dashboardAggregator.current());
    }

    @GetMapping("/evaluatable-users")
    public ResponseEntity<List<EvaluatableUser>> evaluatableUsers() {
        if (!sessionState.isAuthenticated()) {
            return ResponseEntity.status(401).build();
        }
        try {
            log.info("🔍 Loading evaluatable users for diagnostics");
            return ResponseEntity.ok(apiClient.fetchEvaluatableUsers());
        } catch (Exception e) {
            log.error("❌ Error loading evaluatable users", e);
            return ResponseEntity.status(502).build();
        }
    }
}

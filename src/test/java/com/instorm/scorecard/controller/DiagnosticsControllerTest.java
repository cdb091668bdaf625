package com.instorm.scorecard.controller;

import com.instorm.scorecard.client.ScorecardApiClient;
import com.instorm.scorecard.exception.ApiException;
import com.instorm.scorecard.model.domain.User;
import com.instorm.scorecard.service.dashboard.DashboardSnapshot;
import com.instorm.scorecard.model.dto.EvaluatableUser;
import com.instorm.scorecard.model.dto.IndividualMetrics;
import com.instorm.scorecard.service.dashboard.DashboardAggregator;
import com.instorm.scorecard.session.SessionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiagnosticsControllerTest {

    @Mock
    private SessionState sessionState;

    @Mock
    private DashboardAggregator dashboardAggregator;

    @Mock
    private ScorecardApiClient apiClient;

    @InjectMocks
    private DiagnosticsController controller;

    @Test
    void sessionShowsUserRoleLabelAndDashboard() {
        User lead = new User("u-300", "lead@instorm.io", "Lena Lead", "SALES_LEAD");
        DashboardSnapshot snapshot = DashboardSnapshot.ready("SALES_LEAD", IndividualMetrics.zeroed());
        when(sessionState.currentUser()).thenReturn(Optional.of(lead));
        when(dashboardAggregator.current()).thenReturn(snapshot);

        DiagnosticsController.SessionView view = controller.session();

        assertTrue(view.authenticated());
        assertEquals(lead, view.user());
        assertEquals("Sales Lead", view.roleLabel());
        assertSame(snapshot, view.dashboard());
    }

    @Test
    void sessionWithoutUser() {
        when(sessionState.currentUser()).thenReturn(Optional.empty());
        when(dashboardAggregator.current()).thenReturn(DashboardSnapshot.loading(null));

        DiagnosticsController.SessionView view = controller.session();

        assertFalse(view.authenticated());
        assertNull(view.user());
        assertNull(view.roleLabel());
    }

    @Test
    void evaluatableUsersRequireASession() {
        when(sessionState.isAuthenticated()).thenReturn(false);

        ResponseEntity<List<EvaluatableUser>> response = controller.evaluatableUsers();

        assertEquals(401, response.getStatusCode().value());
        verifyNoInteractions(apiClient);
    }

    @Test
    void evaluatableUsersAreReadFromTheApi() {
        List<EvaluatableUser> users = List.of(new EvaluatableUser("u-400", "Sam Seller", "SALESPERSON"));
        when(sessionState.isAuthenticated()).thenReturn(true);
        when(apiClient.fetchEvaluatableUsers()).thenReturn(users);

        ResponseEntity<List<EvaluatableUser>> response = controller.evaluatableUsers();

        assertEquals(200, response.getStatusCode().value());
        assertEquals(users, response.getBody());
    }

    @Test
    void apiFailureIsReportedAsBadGateway() {
        when(sessionState.isAuthenticated()).thenReturn(true);
        when(apiClient.fetchEvaluatableUsers()).thenThrow(new ApiException("Request to /organizations/salespeople failed", new ResourceAccessException("Connection refused")));

        ResponseEntity<List<EvaluatableUser>> response = controller.evaluatableUsers();

        assertEquals(502, response.getStatusCode().value());
        assertNull(response.getBody());
    }
}

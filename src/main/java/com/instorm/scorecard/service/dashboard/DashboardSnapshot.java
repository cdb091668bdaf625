package com.instorm.scorecard.service.dashboard;

import com.instorm.scorecard.model.domain.Role;
import com.instorm.scorecard.model.dto.DirectorateMetrics;
import com.instorm.scorecard.model.dto.IndividualMetrics;

/**
 * What the dashboard shows at a point in time. Exactly one of the metrics is set
 * once the snapshot leaves {@link DashboardStatus#LOADING}: directorate metrics for
 * sales directors, individual metrics for everyone else.
 */
public record DashboardSnapshot(
    DashboardStatus status,
    String role,
    IndividualMetrics individualMetrics,
    DirectorateMetrics directorateMetrics
) {

    public static DashboardSnapshot loading(String role) {
        return new DashboardSnapshot(DashboardStatus.LOADING, role, null, null);
    }

    public static DashboardSnapshot ready(String role, IndividualMetrics metrics) {
        return new DashboardSnapshot(DashboardStatus.READY, role, metrics, null);
    }

    public static DashboardSnapshot ready(String role, DirectorateMetrics metrics) {
        return new DashboardSnapshot(DashboardStatus.READY, role, null, metrics);
    }

    public static DashboardSnapshot failed(String role) {
        if (Role.SALES_DIRECTOR.matches(role)) {
            return new DashboardSnapshot(DashboardStatus.FAILED, role, null, DirectorateMetrics.zeroed());
        }
        return new DashboardSnapshot(DashboardStatus.FAILED, role, IndividualMetrics.zeroed(), null);
    }

    public boolean isDirectorateView() {
        return Role.SALES_DIRECTOR.matches(role);
    }

    public String roleLabel() {
        return Role.displayLabel(role);
    }
}

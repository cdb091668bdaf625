package com.instorm.scorecard.service.dashboard;

public enum DashboardStatus {
    LOADING,
    READY,
    /** The fetch failed; the snapshot carries zeroed metrics. */
    FAILED
}

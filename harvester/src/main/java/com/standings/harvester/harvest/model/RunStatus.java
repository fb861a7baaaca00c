package com.standings.harvester.harvest.model;

public enum RunStatus {
    COMPLETED,
    COMPLETED_WITH_FAILURES,
    CANCELLED
}

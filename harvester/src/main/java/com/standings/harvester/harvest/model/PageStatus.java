package com.standings.harvester.harvest.model;

public enum PageStatus {
    SUCCEEDED,
    FAILED
}

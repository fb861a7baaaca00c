package com.standings.harvester.harvest.model;

public enum PageState {
    REQUESTING,
    SUCCEEDED,
    RETRY_WAIT,
    FAILED,
    EXHAUSTED,
    CANCELLED
}

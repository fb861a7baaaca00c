package com.standings.harvester.harvest.service;

public class ActiveHarvestRunException extends RuntimeException {
    public ActiveHarvestRunException(String message) {
        super(message);
    }
}

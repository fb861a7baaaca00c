package com.standings.harvester.harvest.model;

public record PageRequest(int pageNumber, int attempt) {
    public PageRequest {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1 (was " + pageNumber + ")");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0 (was " + attempt + ")");
        }
    }

    public static PageRequest first(int pageNumber) {
        return new PageRequest(pageNumber, 0);
    }

    public PageRequest nextAttempt() {
        return new PageRequest(pageNumber, attempt + 1);
    }

    public int attemptNumber() {
        return attempt + 1;
    }
}

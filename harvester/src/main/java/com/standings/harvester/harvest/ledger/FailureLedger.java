package com.standings.harvester.harvest.ledger;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Run-scoped set of pages that could not be harvested.
 */
public class FailureLedger {

    private final ConcurrentSkipListSet<Integer> pages = new ConcurrentSkipListSet<>();

    /**
     * @return {@code false} when the page was already recorded
     */
    public boolean record(int pageNumber) {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1 (was " + pageNumber + ")");
        }
        return pages.add(pageNumber);
    }

    public boolean contains(int pageNumber) {
        return pages.contains(pageNumber);
    }

    public int size() {
        return pages.size();
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    public SortedSet<Integer> snapshot() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(pages));
    }
}

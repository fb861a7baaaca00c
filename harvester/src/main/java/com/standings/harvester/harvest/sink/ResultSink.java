package com.standings.harvester.harvest.sink;

import com.standings.harvester.harvest.model.StandingRecord;

import java.util.List;

/**
 * Append-only destination for harvested records. A single {@code write} call is atomic with
 * respect to other calls and durable once it returns.
 *
 * @throws java.io.UncheckedIOException from {@code write} when the underlying stream fails
 */
public interface ResultSink {
    void write(List<StandingRecord> records);
}

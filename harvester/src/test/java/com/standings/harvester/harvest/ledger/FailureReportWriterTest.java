package com.standings.harvester.harvest.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FailureReportWriterTest {

    private final FailureReportWriter writer = new FailureReportWriter(new ObjectMapper());

    @Test
    void writesFailedPagesInAscendingOrder(@TempDir Path tempDir) throws Exception {
        FailureLedger ledger = new FailureLedger();
        ledger.record(9);
        ledger.record(3);
        Path report = tempDir.resolve("reports/failed_attempts.json");

        writer.write(report, ledger);

        assertThat(Files.readString(report, StandardCharsets.UTF_8)).isEqualTo("{\"Failed Pages\":[3,9]}");
    }

    @Test
    void writesEmptyListWhenNothingFailed(@TempDir Path tempDir) throws Exception {
        Path report = tempDir.resolve("failed_attempts.json");
        Files.writeString(report, "stale content that is longer than the new report");

        writer.write(report, new FailureLedger());

        assertThat(Files.readString(report)).isEqualTo("{\"Failed Pages\":[]}");
    }
}

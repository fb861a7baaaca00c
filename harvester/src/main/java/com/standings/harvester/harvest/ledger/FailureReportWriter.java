package com.standings.harvester.harvest.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.standings.harvester.harvest.model.FailureReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

@Component
public class FailureReportWriter {

    private final ObjectMapper objectMapper;

    public FailureReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FailureReport write(Path path, FailureLedger ledger) {
        FailureReport report = new FailureReport(new ArrayList<>(ledger.snapshot()));
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write failure report " + path, e);
        }
        return report;
    }
}

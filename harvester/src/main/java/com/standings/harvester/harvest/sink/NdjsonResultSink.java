package com.standings.harvester.harvest.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.standings.harvester.harvest.model.StandingRecord;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one JSON object per line. Lines of a page are serialized outside the lock and then
 * written and flushed as one chunk, so concurrent pages never interleave.
 */
public class NdjsonResultSink implements ResultSink, Closeable {

    private final Object lock = new Object();
    private final Path path;
    private final Writer writer;
    private final ObjectWriter lineWriter;
    private long linesWritten;
    private boolean closed;

    NdjsonResultSink(Path path, Writer writer, ObjectMapper objectMapper) {
        this.path = path;
        this.writer = writer;
        this.lineWriter = objectMapper.writer();
    }

    public static NdjsonResultSink open(Path path, ObjectMapper objectMapper) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // FileOutputStream is not interruptible: cancelling one worker must not close the stream for the others.
        BufferedWriter writer = new BufferedWriter(
            new OutputStreamWriter(new FileOutputStream(path.toFile(), false), StandardCharsets.UTF_8)
        );
        return new NdjsonResultSink(path, writer, objectMapper);
    }

    @Override
    public void write(List<StandingRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        String chunk = serialize(records);
        synchronized (lock) {
            if (closed) {
                throw new UncheckedIOException(new IOException("Result sink already closed: " + path));
            }
            try {
                writer.write(chunk);
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Could not append records to " + path, e);
            }
            linesWritten += records.size();
        }
    }

    public long linesWritten() {
        synchronized (lock) {
            return linesWritten;
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            writer.close();
        }
    }

    private String serialize(List<StandingRecord> records) {
        StringBuilder chunk = new StringBuilder(records.size() * 96);
        for (StandingRecord record : records) {
            try {
                chunk.append(lineWriter.writeValueAsString(record)).append('\n');
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Could not serialize record " + record, e);
            }
        }
        return chunk.toString();
    }
}

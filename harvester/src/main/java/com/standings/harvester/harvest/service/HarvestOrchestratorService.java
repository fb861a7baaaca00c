package com.standings.harvester.harvest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.standings.harvester.config.HarvesterProperties;
import com.standings.harvester.harvest.events.HarvestEventListener;
import com.standings.harvester.harvest.gate.RateGate;
import com.standings.harvester.harvest.http.StandingsHttpClient;
import com.standings.harvester.harvest.ledger.FailureLedger;
import com.standings.harvester.harvest.ledger.FailureReportWriter;
import com.standings.harvester.harvest.model.HarvestRequest;
import com.standings.harvester.harvest.model.PageResult;
import com.standings.harvester.harvest.model.RunStatus;
import com.standings.harvester.harvest.model.RunSummary;
import com.standings.harvester.harvest.retry.BackoffPolicy;
import com.standings.harvester.harvest.retry.Sleeper;
import com.standings.harvester.harvest.sink.NdjsonResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);
    private static final long WORKER_DRAIN_GRACE_SECONDS = 30;

    private final HarvesterProperties properties;
    private final StandingsHttpClient httpClient;
    private final StandingsPayloadParser payloadParser;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final HarvestEventListener eventListener;
    private final FailureReportWriter failureReportWriter;
    private final ObjectMapper objectMapper;
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();

    public HarvestOrchestratorService(
        HarvesterProperties properties,
        StandingsHttpClient httpClient,
        StandingsPayloadParser payloadParser,
        BackoffPolicy backoffPolicy,
        Sleeper sleeper,
        HarvestEventListener eventListener,
        FailureReportWriter failureReportWriter,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.payloadParser = payloadParser;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.eventListener = eventListener;
        this.failureReportWriter = failureReportWriter;
        this.objectMapper = objectMapper;
    }

    public RunSummary run(HarvestRequest request) {
        int totalPages = request.totalPages() == null
            ? properties.getTotalPages()
            : Math.max(0, request.totalPages());
        int concurrency = request.concurrencyLimit() == null
            ? properties.getConcurrency()
            : Math.max(1, request.concurrencyLimit());
        int maxAttempts = request.maxAttempts() == null
            ? properties.getMaxAttempts()
            : Math.max(1, request.maxAttempts());
        Path outputPath = request.outputPath() == null
            ? Path.of(properties.getOutput().getRecordsPath())
            : request.outputPath();
        Path failuresPath = request.failureReportPath() == null
            ? Path.of(properties.getOutput().getFailuresPath())
            : request.failureReportPath();

        Instant startedAt = Instant.now();
        ActiveRun run = new ActiveRun(startedAt);
        ActiveRun existing = activeRun.compareAndExchange(null, run);
        if (existing != null) {
            throw new ActiveHarvestRunException("Harvest run already in progress (startedAt=" + existing.startedAt + ")");
        }

        try {
            return execute(run, totalPages, concurrency, maxAttempts, outputPath, failuresPath);
        } finally {
            activeRun.set(null);
            run.finished.countDown();
        }
    }

    /**
     * Cancels the active run, if any. Outstanding pages are abandoned without being recorded as
     * failed; {@link #run} still writes the failure report and returns a summary.
     *
     * @return {@code true} when a run was active
     */
    public boolean cancel() {
        ActiveRun run = activeRun.get();
        if (run == null) {
            return false;
        }
        log.warn("Cancelling harvest run started at {}", run.startedAt);
        run.cancel();
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        ActiveRun run = activeRun.get();
        return run == null || run.finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private RunSummary execute(
        ActiveRun run,
        int totalPages,
        int concurrency,
        int maxAttempts,
        Path outputPath,
        Path failuresPath
    ) {
        log.info(
            "Starting harvest. League ID: {}, Total Pages: {}, Concurrency: {}, Max attempts: {}",
            properties.getSource().getLeagueId(),
            totalPages,
            concurrency,
            maxAttempts
        );
        log.info("Output file: {}", outputPath);

        NdjsonResultSink sink;
        try {
            sink = NdjsonResultSink.open(outputPath, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open output file " + outputPath, e);
        }

        FailureLedger ledger = new FailureLedger();
        RateGate rateGate = new RateGate(concurrency);
        PageFetcher fetcher = new PageFetcher(
            httpClient,
            payloadParser,
            backoffPolicy,
            sleeper,
            rateGate,
            sink,
            ledger,
            eventListener,
            maxAttempts
        );
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();
        int progressInterval = properties.getProgressInterval();
        ExecutorService workers = Executors.newFixedThreadPool(workerThreads(concurrency));
        boolean interrupted = false;

        try {
            List<Future<PageResult>> futures = new ArrayList<>(totalPages);
            for (int page = 1; page <= totalPages; page++) {
                if (run.isCancelled()) {
                    break;
                }
                int pageNumber = page;
                Future<PageResult> future = workers.submit(() -> {
                    PageResult result = fetcher.fetch(pageNumber);
                    if (result.isSucceeded()) {
                        succeeded.incrementAndGet();
                    }
                    int done = completed.incrementAndGet();
                    if (done % progressInterval == 0) {
                        log.info("Completed {}/{} pages ({} failed so far, {}/{} calls in flight)",
                            done, totalPages, ledger.size(), rateGate.inFlight(), rateGate.capacity());
                    }
                    return result;
                });
                futures.add(future);
                run.track(future);
                if (page % progressInterval == 0) {
                    log.info("Scheduled {}/{} pages so far...", page, totalPages);
                }
            }
            log.info("All fetch tasks scheduled, now awaiting completion...");
            interrupted = awaitAll(run, futures, ledger);
        } finally {
            shutdownWorkers(workers, run.isCancelled());
            closeSink(sink);
        }

        Duration elapsed = Duration.between(run.startedAt, Instant.now());
        int failed = ledger.size();
        int succeededCount = succeeded.get();
        int cancelledCount = Math.max(0, totalPages - succeededCount - failed);
        RunStatus status = run.isCancelled()
            ? RunStatus.CANCELLED
            : failed > 0 ? RunStatus.COMPLETED_WITH_FAILURES : RunStatus.COMPLETED;

        writeFailureReport(failuresPath, ledger);
        log.info("Data fetching complete.");
        log.info("Total time: {}s", String.format(Locale.ROOT, "%.2f", elapsed.toMillis() / 1000.0));
        log.info("Succeeded: {}, Failed: {}, Cancelled: {}", succeededCount, failed, cancelledCount);
        if (failed > 0) {
            log.warn("Some pages failed. See {} for details.", failuresPath);
        } else {
            log.info("No failed pages!");
        }
        if (status == RunStatus.CANCELLED) {
            log.warn("Harvest was cancelled before all pages completed.");
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        return new RunSummary(
            totalPages,
            succeededCount,
            failed,
            cancelledCount,
            run.startedAt,
            elapsed,
            status,
            outputPath,
            failuresPath
        );
    }

    /**
     * @return {@code true} when the calling thread was interrupted while waiting
     */
    private boolean awaitAll(ActiveRun run, List<Future<PageResult>> futures, FailureLedger ledger) {
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            int pageNumber = i + 1;
            Future<PageResult> future = futures.get(i);
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // Cancelling settles every future, so the next get() returns without blocking.
                    interrupted = true;
                    run.cancel();
                } catch (CancellationException e) {
                    log.debug("Page {} abandoned by cancellation", pageNumber);
                    break;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (!(cause instanceof InterruptedException)) {
                        log.warn("Page {} task failed unexpectedly", pageNumber, cause);
                        ledger.record(pageNumber);
                    }
                    break;
                }
            }
        }
        return interrupted;
    }

    private int workerThreads(int concurrency) {
        int configured = properties.getWorkerThreads();
        if (configured > 0) {
            return configured;
        }
        return Math.max(4, concurrency * 2);
    }

    private void shutdownWorkers(ExecutorService workers, boolean cancelled) {
        if (cancelled) {
            workers.shutdownNow();
        } else {
            workers.shutdown();
        }
        long graceSeconds = properties.getRequestTimeoutSeconds() + WORKER_DRAIN_GRACE_SECONDS;
        try {
            if (!workers.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within {}s", graceSeconds);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void closeSink(NdjsonResultSink sink) {
        try {
            sink.close();
        } catch (IOException e) {
            log.error("Could not close output file {}", sink.path(), e);
        }
    }

    private void writeFailureReport(Path failuresPath, FailureLedger ledger) {
        try {
            failureReportWriter.write(failuresPath, ledger);
            log.info("Wrote failure report: {}", failuresPath);
        } catch (UncheckedIOException e) {
            log.error("Could not write failure report {}", failuresPath, e);
        }
    }

    private static final class ActiveRun {
        private final Instant startedAt;
        private final Queue<Future<?>> futures = new ConcurrentLinkedQueue<>();
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile boolean cancelled;

        private ActiveRun(Instant startedAt) {
            this.startedAt = startedAt;
        }

        void track(Future<?> future) {
            futures.add(future);
            if (cancelled) {
                future.cancel(true);
            }
        }

        void cancel() {
            cancelled = true;
            for (Future<?> future : futures) {
                future.cancel(true);
            }
        }

        boolean isCancelled() {
            return cancelled;
        }
    }
}

package com.standings.harvester.harvest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.standings.harvester.harvest.events.HarvestEventListener;
import com.standings.harvester.harvest.gate.RateGate;
import com.standings.harvester.harvest.http.StandingsHttpClient;
import com.standings.harvester.harvest.ledger.FailureLedger;
import com.standings.harvester.harvest.model.FailureKind;
import com.standings.harvester.harvest.model.FetchOutcome;
import com.standings.harvester.harvest.model.HttpFetchResult;
import com.standings.harvester.harvest.model.PageEvent;
import com.standings.harvester.harvest.model.PageRequest;
import com.standings.harvester.harvest.model.PageResult;
import com.standings.harvester.harvest.model.StandingRecord;
import com.standings.harvester.harvest.retry.BackoffPolicy;
import com.standings.harvester.harvest.retry.Sleeper;
import com.standings.harvester.harvest.sink.ResultSink;
import com.standings.harvester.harvest.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives one page through {@code REQUESTING -> RETRY_WAIT -> ... -> SUCCEEDED | FAILED | EXHAUSTED}.
 *
 * <p>One instance serves a whole run and is shared by all worker threads; per-page state lives on
 * the stack of {@link #fetch(int)}. Attempts of a page run strictly one after another. The rate
 * gate permit covers the remote call only, never the backoff wait.
 */
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final StandingsHttpClient httpClient;
    private final StandingsPayloadParser payloadParser;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final RateGate rateGate;
    private final ResultSink resultSink;
    private final FailureLedger failureLedger;
    private final HarvestEventListener eventListener;
    private final int maxAttempts;

    public PageFetcher(
        StandingsHttpClient httpClient,
        StandingsPayloadParser payloadParser,
        BackoffPolicy backoffPolicy,
        Sleeper sleeper,
        RateGate rateGate,
        ResultSink resultSink,
        FailureLedger failureLedger,
        HarvestEventListener eventListener,
        int maxAttempts
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (was " + maxAttempts + ")");
        }
        this.httpClient = httpClient;
        this.payloadParser = payloadParser;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.rateGate = rateGate;
        this.resultSink = resultSink;
        this.failureLedger = failureLedger;
        this.eventListener = eventListener;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws InterruptedException when the run is cancelled; the page is then neither written
     *     nor recorded as failed
     */
    public PageResult fetch(int pageNumber) throws InterruptedException {
        Instant startedAt = Instant.now();
        PageRequest request = PageRequest.first(pageNumber);
        FetchOutcome lastOutcome = null;
        try {
            while (true) {
                emit(PageEvent.requesting(request, maxAttempts));
                FetchOutcome outcome = attempt(request);
                lastOutcome = outcome;

                if (outcome.isSuccess()) {
                    return deliver(request, outcome, startedAt);
                }
                if (outcome.isCancelled()) {
                    Thread.interrupted();
                    throw new InterruptedException("Harvest cancelled while fetching page " + pageNumber);
                }
                if (!outcome.isRetryable()) {
                    return fail(request, outcome, startedAt);
                }
                if (request.attemptNumber() >= maxAttempts) {
                    break;
                }
                emit(PageEvent.retryWait(request, maxAttempts, outcome));
                sleeper.sleep(outcome.waitHint());
                request = request.nextAttempt();
            }
        } catch (InterruptedException e) {
            emit(PageEvent.cancelled(request, maxAttempts, elapsedSince(startedAt)));
            throw e;
        }
        return exhaust(request, lastOutcome, startedAt);
    }

    FetchOutcome attempt(PageRequest request) throws InterruptedException {
        HttpFetchResult result;
        try (RateGate.Permit permit = rateGate.acquire()) {
            result = httpClient.fetchPage(request.pageNumber());
        } catch (RuntimeException e) {
            log.debug("Page {} attempt {} raised an unexpected error", request.pageNumber(), request.attemptNumber(), e);
            return retryable(request, FailureKind.UNEXPECTED_ERROR, ReasonCodeClassifier.UNKNOWN, 0);
        }
        if (result == null) {
            return retryable(request, FailureKind.UNEXPECTED_ERROR, ReasonCodeClassifier.UNKNOWN, 0);
        }
        try {
            return classify(request, result);
        } catch (RuntimeException e) {
            log.debug("Page {} attempt {} could not be classified", request.pageNumber(), request.attemptNumber(), e);
            return retryable(request, FailureKind.UNEXPECTED_ERROR, ReasonCodeClassifier.UNKNOWN, result.statusCode());
        }
    }

    FetchOutcome classify(PageRequest request, HttpFetchResult result) {
        if (result.hasError()) {
            if ("interrupted".equals(result.errorCode())) {
                return FetchOutcome.terminal(FailureKind.CANCELLED, "interrupted", 0);
            }
            String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            FailureKind kind = "timeout".equals(result.errorCode()) || "io_error".equals(result.errorCode())
                ? FailureKind.CONNECTION_ERROR
                : FailureKind.UNEXPECTED_ERROR;
            log.debug("Page {} attempt {} failed: {} {}", request.pageNumber(), request.attemptNumber(),
                result.errorCode(), result.errorMessage());
            return retryable(request, kind, reason, 0);
        }

        int status = result.statusCode();
        String statusReason = ReasonCodeClassifier.fromHttpStatus(status);
        if (status == 429) {
            return retryable(request, FailureKind.RATE_LIMITED, statusReason, status);
        }
        if (status < 200 || status >= 300) {
            FailureKind kind = ReasonCodeClassifier.isServerError(status)
                ? FailureKind.SERVER_ERROR
                : FailureKind.CLIENT_PROTOCOL_ERROR;
            return retryable(request, kind, statusReason, status);
        }

        String body = result.body();
        if (body == null || body.isBlank()) {
            return retryable(request, FailureKind.UNEXPECTED_ERROR, ReasonCodeClassifier.UNREADABLE_BODY, status);
        }
        try {
            List<StandingRecord> records = payloadParser.parse(body);
            return FetchOutcome.success(status, records);
        } catch (MalformedPayloadException e) {
            return FetchOutcome.terminal(FailureKind.MALFORMED_RESPONSE, ReasonCodeClassifier.MISSING_RESULTS, status);
        } catch (JsonProcessingException e) {
            return retryable(request, FailureKind.UNEXPECTED_ERROR, ReasonCodeClassifier.UNREADABLE_BODY, status);
        }
    }

    private FetchOutcome retryable(PageRequest request, FailureKind kind, String reason, int status) {
        return FetchOutcome.retryable(kind, reason, status, backoffPolicy.delay(request.attempt(), kind));
    }

    private PageResult deliver(PageRequest request, FetchOutcome outcome, Instant startedAt)
        throws InterruptedException {
        List<StandingRecord> records = outcome.records();
        try {
            resultSink.write(records);
        } catch (UncheckedIOException e) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Harvest cancelled while writing page " + request.pageNumber());
            }
            return writeFailed(request, outcome, records, e, startedAt);
        } catch (RuntimeException e) {
            return writeFailed(request, outcome, records, e, startedAt);
        }
        Duration elapsed = elapsedSince(startedAt);
        emit(PageEvent.succeeded(request, maxAttempts, outcome.statusCode(), records.size(), elapsed));
        return PageResult.succeeded(request.pageNumber(), request.attemptNumber(), records.size(), elapsed);
    }

    // A page whose records may be partly written is never retried.
    private PageResult writeFailed(
        PageRequest request,
        FetchOutcome outcome,
        List<StandingRecord> records,
        RuntimeException error,
        Instant startedAt
    ) {
        log.error("Page {}: could not write {} records", request.pageNumber(), records.size(), error);
        FetchOutcome writeFailure = FetchOutcome.terminal(
            FailureKind.UNEXPECTED_ERROR,
            ReasonCodeClassifier.OUTPUT_WRITE_FAILED,
            outcome.statusCode()
        );
        return fail(request, writeFailure, startedAt);
    }

    private PageResult fail(PageRequest request, FetchOutcome outcome, Instant startedAt) {
        failureLedger.record(request.pageNumber());
        Duration elapsed = elapsedSince(startedAt);
        emit(PageEvent.failed(request, maxAttempts, outcome, elapsed));
        return PageResult.failed(request.pageNumber(), request.attemptNumber(), outcome.kind(), outcome.reason(), elapsed);
    }

    private PageResult exhaust(PageRequest request, FetchOutcome lastOutcome, Instant startedAt) {
        failureLedger.record(request.pageNumber());
        Duration elapsed = elapsedSince(startedAt);
        emit(PageEvent.exhausted(request, maxAttempts, lastOutcome, elapsed));
        FailureKind kind = lastOutcome == null ? null : lastOutcome.kind();
        String reason = lastOutcome == null ? null : lastOutcome.reason();
        return PageResult.failed(request.pageNumber(), request.attemptNumber(), kind, reason, elapsed);
    }

    private void emit(PageEvent event) {
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Event listener failed for page {} ({})", event.pageNumber(), event.state(), e);
        }
    }

    private static Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }
}

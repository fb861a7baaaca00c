package com.standings.harvester.harvest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.standings.harvester.config.HarvesterProperties;
import com.standings.harvester.harvest.events.LoggingHarvestEventListener;
import com.standings.harvester.harvest.http.StandingsHttpClient;
import com.standings.harvester.harvest.ledger.FailureReportWriter;
import com.standings.harvester.harvest.model.HarvestRequest;
import com.standings.harvester.harvest.model.HttpFetchResult;
import com.standings.harvester.harvest.model.RunStatus;
import com.standings.harvester.harvest.model.RunSummary;
import com.standings.harvester.harvest.retry.BackoffPolicy;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

class HarvestOrchestratorServiceTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final CountDownLatch releaseBlockedPages = new CountDownLatch(1);

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService testExecutor;
    private HarvesterProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(8);
        testExecutor = Executors.newSingleThreadExecutor();
        properties = new HarvesterProperties();
        properties.setRequestTimeoutSeconds(10);
        properties.setConnectTimeoutSeconds(2);
        properties.setProgressInterval(1);
        properties.getSource().setUrlTemplate(
            server.url("/api/leagues-classic/{leagueId}/standings/").toString() + "?page_standings={page}"
        );
        properties.getOutput().setRecordsPath(tempDir.resolve("player_data.json").toString());
        properties.getOutput().setFailuresPath(tempDir.resolve("failed_attempts.json").toString());
    }

    @AfterEach
    void tearDown() throws Exception {
        releaseBlockedPages.countDown();
        testExecutor.shutdownNow();
        server.shutdown();
        httpExecutor.shutdownNow();
    }

    @Test
    void writesRecordsAndReportsPagesThatNeverSucceed() throws Exception {
        AtomicInteger pageTwoCalls = new AtomicInteger();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("page_standings");
                switch (page) {
                    case "1":
                        return json(entry("Ann", "Alpha", 1) + "," + entry("Ben", "Beta", 2));
                    case "2":
                        if (pageTwoCalls.incrementAndGet() == 1) {
                            return new MockResponse().setResponseCode(429);
                        }
                        return json(entry("Cy", "Gamma", 3));
                    default:
                        return new MockResponse().setResponseCode(500);
                }
            }
        });

        RunSummary summary = service().run(HarvestRequest.of(3, 2));

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED_WITH_FAILURES);
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.cancelled()).isZero();
        assertThat(Files.readString(summary.failureReportPath(), StandardCharsets.UTF_8))
            .isEqualTo("{\"Failed Pages\":[3]}");
        List<String> lines = Files.readAllLines(summary.outputPath(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        assertThat(lines).contains("{\"Full Name\":\"Cy\",\"Team Name\":\"Gamma\",\"Player ID\":3}");
        assertThat(sleeps).containsExactlyInAnyOrder(
            Duration.ofSeconds(5),
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)
        );
        assertThat(pageTwoCalls.get()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(1 + 2 + 5);
    }

    @Test
    void accountsForEveryPageExactlyOnceAndRespectsConcurrencyLimit() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(20);
                    int page = Integer.parseInt(request.getRequestUrl().queryParameter("page_standings"));
                    if (page % 7 == 0) {
                        return json("");
                    }
                    if (page % 5 == 0) {
                        return new MockResponse().setResponseCode(200).setBody("{\"standings\":{}}");
                    }
                    return json(entry("Player " + page, "Team " + page, page));
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        });

        RunSummary summary = service().run(HarvestRequest.of(30, 3));

        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(summary.succeeded() + summary.failed() + summary.cancelled()).isEqualTo(30);
        // Multiples of 5 are malformed; multiples of 7 are empty but valid pages.
        assertThat(summary.failed()).isEqualTo(6);
        assertThat(summary.succeeded()).isEqualTo(24);

        Set<Long> written = new HashSet<>();
        for (String line : Files.readAllLines(summary.outputPath(), StandardCharsets.UTF_8)) {
            written.add(objectMapper.readTree(line).get("Player ID").asLong());
        }
        Set<Long> failed = new HashSet<>();
        objectMapper.readTree(summary.failureReportPath().toFile()).get("Failed Pages")
            .forEach(node -> failed.add(node.asLong()));
        assertThat(failed).containsExactlyInAnyOrder(5L, 10L, 15L, 20L, 25L, 30L);
        for (long page = 1; page <= 30; page++) {
            if (page % 7 == 0) {
                continue;
            }
            assertThat(written.contains(page) ^ failed.contains(page)).as("page %s", page).isTrue();
        }
    }

    @Test
    void workerFaultOnOnePageDoesNotStopTheOthers() throws Exception {
        StandingsHttpClient faultyClient = Mockito.mock(StandingsHttpClient.class);
        when(faultyClient.fetchPage(anyInt())).thenAnswer(invocation -> {
            int page = invocation.getArgument(0);
            if (page == 2) {
                throw new Error("worker state corrupted on page 2");
            }
            String body = "{\"standings\":{\"results\":[" + entry("P" + page, "T" + page, page) + "]}}";
            return new HttpFetchResult("http://test/" + page, 200, body, Instant.now(), Duration.ZERO, null, null);
        });

        RunSummary summary = service(faultyClient).run(HarvestRequest.of(4, 2));

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED_WITH_FAILURES);
        assertThat(summary.succeeded()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.succeeded() + summary.failed()).isEqualTo(summary.totalPages());
        assertThat(Files.readString(summary.failureReportPath())).isEqualTo("{\"Failed Pages\":[2]}");
        assertThat(Files.readAllLines(summary.outputPath())).hasSize(3);
    }

    @Test
    void interruptingTheCallingThreadCancelsTheRun() throws Exception {
        CountDownLatch firstRequest = new CountDownLatch(1);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                firstRequest.countDown();
                releaseBlockedPages.await(30, TimeUnit.SECONDS);
                return json(entry("Late", "Late", 1));
            }
        });
        HarvestOrchestratorService service = service();
        AtomicReference<RunSummary> summaryRef = new AtomicReference<>();
        AtomicBoolean interruptRestored = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            summaryRef.set(service.run(HarvestRequest.of(20, 2)));
            interruptRestored.set(Thread.currentThread().isInterrupted());
        }, "harvest-caller");

        caller.start();
        assertThat(firstRequest.await(10, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(30_000);

        assertThat(caller.isAlive()).isFalse();
        RunSummary summary = summaryRef.get();
        assertThat(summary).isNotNull();
        assertThat(summary.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(summary.failed()).isZero();
        assertThat(summary.cancelled()).isEqualTo(20);
        assertThat(Files.readString(summary.failureReportPath())).isEqualTo("{\"Failed Pages\":[]}");
        assertThat(interruptRestored.get()).isTrue();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void zeroPagesWritesEmptyOutputs() throws Exception {
        RunSummary summary = service().run(HarvestRequest.of(0, 4));

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(Files.size(summary.outputPath())).isZero();
        assertThat(Files.readString(summary.failureReportPath())).isEqualTo("{\"Failed Pages\":[]}");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void cancellationStopsOutstandingPagesWithoutRecordingThem() throws Exception {
        CountDownLatch firstRequest = new CountDownLatch(1);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                firstRequest.countDown();
                releaseBlockedPages.await(30, TimeUnit.SECONDS);
                return json(entry("Late", "Late", 1));
            }
        });
        HarvestOrchestratorService service = service();

        Future<RunSummary> running = testExecutor.submit(() -> service.run(HarvestRequest.of(50, 2)));
        assertThat(firstRequest.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(() -> service.run(HarvestRequest.of(1, 1)))
            .isInstanceOf(ActiveHarvestRunException.class);

        assertThat(service.cancel()).isTrue();
        RunSummary summary = running.get(30, TimeUnit.SECONDS);

        assertThat(summary.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(summary.failed()).isZero();
        assertThat(summary.succeeded()).isZero();
        assertThat(summary.cancelled()).isEqualTo(50);
        assertThat(Files.readString(summary.failureReportPath())).isEqualTo("{\"Failed Pages\":[]}");
        assertThat(service.isRunning()).isFalse();
        assertThat(service.awaitIdle(Duration.ofSeconds(1))).isTrue();
        assertThat(service.cancel()).isFalse();
    }

    private HarvestOrchestratorService service() {
        return service(new StandingsHttpClient(properties, httpExecutor));
    }

    private HarvestOrchestratorService service(StandingsHttpClient httpClient) {
        return new HarvestOrchestratorService(
            properties,
            httpClient,
            new StandingsPayloadParser(objectMapper),
            BackoffPolicy.defaults(),
            sleeps::add,
            new LoggingHarvestEventListener(),
            new FailureReportWriter(objectMapper),
            objectMapper
        );
    }

    private static MockResponse json(String entries) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"standings\":{\"results\":[" + entries + "]}}");
    }

    private static String entry(String name, String team, long id) {
        return "{\"player_name\":\"" + name + "\",\"entry_name\":\"" + team + "\",\"entry\":" + id + "}";
    }
}

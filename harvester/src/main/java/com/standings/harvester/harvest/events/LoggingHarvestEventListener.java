package com.standings.harvester.harvest.events;

import com.standings.harvester.harvest.model.FailureKind;
import com.standings.harvester.harvest.model.PageEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

@Component
public class LoggingHarvestEventListener implements HarvestEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingHarvestEventListener.class);

    @Override
    public void onEvent(PageEvent event) {
        switch (event.state()) {
            case REQUESTING -> log.info(
                "Fetching page {} (Attempt {}/{})...",
                event.pageNumber(),
                event.attemptNumber(),
                event.maxAttempts()
            );
            case SUCCEEDED -> log.info(
                "Page {} fetched successfully with {} players in {}s.",
                event.pageNumber(),
                event.recordCount(),
                seconds(event.elapsed())
            );
            case RETRY_WAIT -> logRetryWait(event);
            case FAILED -> log.error(
                "Page {} failed without retry: {} ({})",
                event.pageNumber(),
                event.kind(),
                event.reason()
            );
            case EXHAUSTED -> log.error(
                "All attempts failed for page {} (last: {} {}).",
                event.pageNumber(),
                event.kind(),
                event.reason()
            );
            case CANCELLED -> log.debug("Page {} cancelled at attempt {}.", event.pageNumber(), event.attemptNumber());
        }
    }

    private void logRetryWait(PageEvent event) {
        String wait = seconds(event.delay());
        FailureKind kind = event.kind();
        if (kind == FailureKind.RATE_LIMITED) {
            log.warn("Rate limit hit on page {}. Waiting {}s before retrying...", event.pageNumber(), wait);
        } else if (kind == FailureKind.SERVER_ERROR || kind == FailureKind.CLIENT_PROTOCOL_ERROR) {
            log.error(
                "Page {}: HTTP {}. Retrying in {}s (Attempt {}/{}).",
                event.pageNumber(),
                event.statusCode(),
                wait,
                event.attemptNumber(),
                event.maxAttempts()
            );
        } else if (kind == FailureKind.CONNECTION_ERROR) {
            log.error("Connection error on page {}: {}. Waiting {}s before retry...", event.pageNumber(), event.reason(), wait);
        } else {
            log.error("Unexpected error on page {}: {}. Waiting {}s before retry...", event.pageNumber(), event.reason(), wait);
        }
    }

    private static String seconds(Duration duration) {
        long millis = duration == null ? 0 : duration.toMillis();
        return String.format(Locale.ROOT, "%.2f", millis / 1000.0);
    }
}

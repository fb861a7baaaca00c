package com.standings.harvester.harvest.events;

import com.standings.harvester.harvest.model.PageEvent;

/**
 * Receives one event per page state transition. Called from worker threads.
 */
public interface HarvestEventListener {
    void onEvent(PageEvent event);
}

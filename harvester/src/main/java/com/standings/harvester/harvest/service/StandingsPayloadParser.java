package com.standings.harvester.harvest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.standings.harvester.harvest.model.StandingRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class StandingsPayloadParser {

    private final ObjectMapper objectMapper;

    public StandingsPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts one record per entry of {@code standings.results}.
     *
     * @throws JsonProcessingException when the body is not JSON
     * @throws MalformedPayloadException when the body is JSON but lacks {@code standings.results}
     */
    public List<StandingRecord> parse(String body) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode results = root == null ? null : root.path("standings").path("results");
        if (results == null || !results.isArray()) {
            throw new MalformedPayloadException("Expected keys not found in the response");
        }
        List<StandingRecord> records = new ArrayList<>(results.size());
        for (JsonNode entry : results) {
            records.add(new StandingRecord(
                text(entry, "player_name"),
                text(entry, "entry_name"),
                raw(entry, "entry")
            ));
        }
        return records;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private JsonNode raw(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.deepCopy();
    }
}

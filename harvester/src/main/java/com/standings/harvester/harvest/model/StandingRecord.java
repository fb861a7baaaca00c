package com.standings.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One output line. {@code playerId} is the upstream {@code entry} value as received, so ids are
 * written exactly as the API sent them.
 */
@JsonPropertyOrder({"Full Name", "Team Name", "Player ID"})
public record StandingRecord(
    @JsonProperty("Full Name") String fullName,
    @JsonProperty("Team Name") String teamName,
    @JsonProperty("Player ID") JsonNode playerId
) {
}

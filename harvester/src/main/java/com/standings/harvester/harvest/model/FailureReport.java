package com.standings.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FailureReport(@JsonProperty("Failed Pages") List<Integer> failedPages) {
}

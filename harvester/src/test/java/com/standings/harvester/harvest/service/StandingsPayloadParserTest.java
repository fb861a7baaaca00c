package com.standings.harvester.harvest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.standings.harvester.harvest.model.StandingRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandingsPayloadParserTest {
    private final StandingsPayloadParser parser = new StandingsPayloadParser(new ObjectMapper());

    @Test
    void extractsNameTeamAndEntryFromResults() throws Exception {
        String body = """
            {"league": {"id": 314},
             "standings": {"has_next": true, "page": 1, "results": [
               {"id": 1, "player_name": "Jane Doe", "entry_name": "Doe FC", "entry": 1234, "rank": 1},
               {"id": 2, "player_name": "John Roe", "entry_name": "Roe Rovers", "entry": 5678, "rank": 2}
             ]}}
            """;

        List<StandingRecord> records = parser.parse(body);

        assertThat(records).containsExactly(
            new StandingRecord("Jane Doe", "Doe FC", IntNode.valueOf(1234)),
            new StandingRecord("John Roe", "Roe Rovers", IntNode.valueOf(5678))
        );
    }

    @Test
    void emptyResultsIsASuccessfulEmptyPage() throws Exception {
        assertThat(parser.parse("{\"standings\":{\"results\":[]}}")).isEmpty();
    }

    @Test
    void missingFieldsBecomeNull() throws Exception {
        List<StandingRecord> records = parser.parse(
            "{\"standings\":{\"results\":[{\"player_name\":\"Solo\",\"entry\":\"99\"},{\"entry_name\":\"X\",\"entry\":null}]}}"
        );

        assertThat(records).containsExactly(
            new StandingRecord("Solo", null, TextNode.valueOf("99")),
            new StandingRecord(null, "X", null)
        );
    }

    @Test
    void entryIdIsWrittenExactlyAsReceived() throws Exception {
        List<StandingRecord> records = parser.parse(
            "{\"standings\":{\"results\":["
                + "{\"player_name\":\"A\",\"entry_name\":\"a\",\"entry\":12.5},"
                + "{\"player_name\":\"B\",\"entry_name\":\"b\",\"entry\":98765432109876543210},"
                + "{\"player_name\":\"C\",\"entry_name\":\"c\",\"entry\":\"x-7\"}"
                + "]}}"
        );

        assertThat(records).extracting(record -> record.playerId().toString())
            .containsExactly("12.5", "98765432109876543210", "\"x-7\"");
    }

    @Test
    void missingStandingsIsMalformed() {
        assertThatThrownBy(() -> parser.parse("{\"detail\":\"Not found.\"}"))
            .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> parser.parse("{\"standings\":{}}"))
            .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> parser.parse("{\"standings\":{\"results\":{}}}"))
            .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void nonJsonBodyIsAParseError() {
        assertThatThrownBy(() -> parser.parse("<html>maintenance</html>"))
            .isInstanceOf(JsonProcessingException.class);
    }
}

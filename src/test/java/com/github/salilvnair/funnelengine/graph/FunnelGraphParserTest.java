package com.github.salilvnair.funnelengine.graph;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.GraphIntegrityException;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunnelGraphParserTest {

    private static final String DOCUMENT = """
            {
              "startBlockId": "welcome",
              "generatedBy": "builder-ui",
              "stages": [
                {"id": "s1", "name": "WELCOME", "explanation": "qualify", "blockIds": ["welcome"]},
                {"id": "s2", "name": "VALUE_DELIVERY", "blockIds": ["guide"]}
              ],
              "blocks": {
                "welcome": {
                  "id": "welcome",
                  "message": "Hi! Pick your niche",
                  "options": [
                    {"text": "E-commerce", "nextBlockId": "guide"},
                    {"text": "Not now", "nextBlockId": ""}
                  ]
                },
                "guide": {
                  "message": "Your guide: [LINK]",
                  "resourceName": "Guide",
                  "options": []
                }
              }
            }
            """;

    private final FunnelGraphParser parser = new FunnelGraphParser();

    @Test
    void parsesDocumentIntoValidatedGraph() {
        FunnelGraph graph = parser.parse(DOCUMENT);

        assertEquals("welcome", graph.startBlockId());
        assertEquals(2, graph.stages().size());
        FunnelBlock welcome = graph.startBlock();
        assertEquals(2, welcome.options().size());
        assertTrue(welcome.options().get(1).isTerminal());
        FunnelBlock guide = graph.resolveBlock("guide").orElseThrow();
        assertEquals("guide", guide.id());
        assertEquals("Guide", guide.resourceName());
        assertFalse(guide.hasOptions());
        assertNull(welcome.resourceName());
    }

    @Test
    void invalidJsonIsRefusedAsUnreadable() {
        GraphIntegrityException ex = assertThrows(GraphIntegrityException.class, () -> parser.parse("{not json"));

        assertTrue(ex.is(FunnelEngineErrorCode.GRAPH_DOCUMENT_UNREADABLE));
    }

    @Test
    void emptyDocumentIsRefused() {
        GraphIntegrityException ex = assertThrows(GraphIntegrityException.class, () -> parser.parse("  "));

        assertTrue(ex.is(FunnelEngineErrorCode.GRAPH_INTEGRITY_VIOLATION));
    }

    @Test
    void literalNullDocumentIsRefused() {
        GraphIntegrityException ex = assertThrows(GraphIntegrityException.class, () -> parser.parse("null"));

        assertTrue(ex.is(FunnelEngineErrorCode.GRAPH_INTEGRITY_VIOLATION));
        assertEquals(List.of("funnel graph document is empty"), ex.getViolations());
    }

    @Test
    void danglingEdgeInDocumentIsRefusedAtLoadTime() {
        String broken = DOCUMENT.replace("\"nextBlockId\": \"guide\"", "\"nextBlockId\": \"gone\"");

        GraphIntegrityException ex = assertThrows(GraphIntegrityException.class, () -> parser.parse(broken));

        assertEquals(1, ex.getViolations().size());
        assertTrue(ex.getViolations().get(0).contains("'gone'"));
    }
}

package com.kgraph.resolution.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.EntityType;
import com.kgraph.resolution.core.model.MergeDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DecisionLog Tests")
class DecisionLogTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private DecisionLog decisionLog;

    @BeforeEach
    void setUp() {
        decisionLog = new DecisionLog();
        decisionLog.append(decision("doc@0-5", "Apple", null, 1, DecisionTier.NEW_ENTITY, T0));
        decisionLog.append(decision("doc@10-19", "Apple Inc", 1, 1, DecisionTier.HIGH_CONFIDENCE, T0.plusSeconds(10)));
        decisionLog.append(decision("doc@30-38", "Tim Cook", null, 2, DecisionTier.NEW_ENTITY, T0.plusSeconds(20)));
        decisionLog.append(decision("doc@40-52", "Timothy Cook", 2, 2, DecisionTier.LOW_CONFIDENCE, T0.plusSeconds(30)));
    }

    private static MergeDecision decision(String mentionId, String surface, Integer matched, int result,
                                          DecisionTier tier, Instant timestamp) {
        return MergeDecision.builder()
                .mentionId(mentionId)
                .surfaceForm(surface)
                .normalizedKey(surface.toLowerCase())
                .entityType(surface.startsWith("Apple") ? EntityType.ORGANIZATION : EntityType.PERSON)
                .matchedEntityId(matched)
                .resultEntityId(result)
                .score(matched != null ? 0.9 : 0.0)
                .tier(tier)
                .reasoning("test")
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("Should keep records in append order")
    void appendOrder() {
        List<MergeDecision> all = decisionLog.getAll();

        assertEquals(4, decisionLog.size());
        assertEquals("doc@0-5", all.get(0).mentionId());
        assertEquals("doc@40-52", all.get(3).mentionId());
    }

    @Test
    @DisplayName("Returned lists should be snapshots")
    void snapshots() {
        List<MergeDecision> before = decisionLog.getAll();
        decisionLog.append(decision("doc@60-65", "Apple", 1, 1, DecisionTier.HIGH_CONFIDENCE, T0));

        assertEquals(4, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(before.get(0)));
    }

    @Test
    @DisplayName("Should query by entity, mention, tier and time")
    void queries() {
        assertEquals(2, decisionLog.forEntity(1).size());
        assertEquals(1, decisionLog.forMention("doc@30-38").size());
        assertEquals(2, decisionLog.byTier(DecisionTier.NEW_ENTITY).size());
        assertEquals(List.of("doc@10-19", "doc@30-38"), decisionLog.between(T0.plusSeconds(5), T0.plusSeconds(20))
                .stream().map(MergeDecision::mentionId).toList());
    }

    @Test
    @DisplayName("Created entities should be rendered as 'new'")
    void newEntityLabel() {
        MergeDecision created = decisionLog.getAll().get(0);

        assertFalse(created.isMerge());
        assertEquals(MergeDecision.NEW_ENTITY, created.matchedEntityLabel());
        assertEquals("1", decisionLog.getAll().get(1).matchedEntityLabel());
    }

    @Test
    @DisplayName("Exporter should write one JSON object per line")
    void exportJsonLines() throws IOException {
        StringWriter out = new StringWriter();

        int written = new DecisionLogExporter().export(decisionLog, out);

        String[] lines = out.toString().split("\n");
        assertEquals(4, written);
        assertEquals(4, lines.length);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode first = mapper.readTree(lines[0]);
        assertEquals("doc@0-5", first.get("mentionId").asText());
        assertEquals("new", first.get("matchedEntityId").asText());
        assertEquals(1, first.get("resultEntityId").asInt());
        assertEquals("NEW_ENTITY", first.get("tier").asText());
        assertEquals("ORGANIZATION", first.get("entityType").asText());
        assertEquals(T0.toString(), first.get("timestamp").asText());

        JsonNode last = mapper.readTree(lines[3]);
        assertEquals("2", last.get("matchedEntityId").asText());
        assertEquals(0.9, last.get("score").asDouble(), 1e-9);
    }

    @Test
    @DisplayName("Exporter should surface write failures")
    void exportFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        assertThrows(UncheckedIOException.class, () -> new DecisionLogExporter().export(decisionLog, broken));
    }
}

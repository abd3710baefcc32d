package com.kgraph.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Ingestion context should set and clear MDC keys")
    void ingestionContext() {
        try (LogContext ctx = LogContext.forIngestion("corr-1", "doc-1")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("doc-1", MDC.get("documentId"));
            assertEquals("ingest", MDC.get("operation"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("documentId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Chunk context should carry the chunk index")
    void chunkContext() {
        try (LogContext ctx = LogContext.forChunk("doc-1", 3)) {
            assertEquals("3", MDC.get("chunkIndex"));
            assertEquals("extract", MDC.get("operation"));
        }
        assertNull(MDC.get("chunkIndex"));
    }

    @Test
    @DisplayName("Merge context should carry mention and blocking key")
    void mergeContext() {
        try (LogContext ctx = LogContext.forMerge("doc-1@0-5", "ORGANIZATION|app")) {
            assertEquals("doc-1@0-5", MDC.get("mentionId"));
            assertEquals("ORGANIZATION|app", MDC.get("blockingKey"));
        }
        assertNull(MDC.get("mentionId"));
    }

    @Test
    @DisplayName("with() should add keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forSearch("corr-2").with("limit", "10")) {
            assertEquals("search", MDC.get("operation"));
            assertEquals("10", MDC.get("limit"));
        }
        assertNull(MDC.get("limit"));
    }

    @Test
    @DisplayName("Should leave unrelated MDC keys alone")
    void leavesOtherKeys() {
        MDC.put("tenant", "acme");
        try (LogContext ctx = LogContext.forSearch("corr-3")) {
            assertEquals("acme", MDC.get("tenant"));
        }
        assertEquals("acme", MDC.get("tenant"));
    }

    @Test
    @DisplayName("Correlation ids should be unique")
    void uniqueCorrelationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}

package com.kgraph.resolution.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgraph.resolution.core.model.MergeDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes decision records as JSON lines, one object per record.
 *
 * <pre>
 * {"id":"...","mentionId":"doc-1@0-5","surfaceForm":"Apple","normalizedKey":"apple",
 *  "entityType":"ORGANIZATION","matchedEntityId":"new","resultEntityId":1,"score":0.0,
 *  "tier":"NEW_ENTITY","reasoning":"...","timestamp":"2024-05-01T10:00:00Z"}
 * </pre>
 */
public class DecisionLogExporter {
    private static final Logger log = LoggerFactory.getLogger(DecisionLogExporter.class);

    private final ObjectMapper objectMapper;

    public DecisionLogExporter() {
        this(new ObjectMapper());
    }

    public DecisionLogExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes every record of the log to {@code out}.
     *
     * @return number of records written
     */
    public int export(DecisionLog decisionLog, Writer out) {
        return export(decisionLog.getAll(), out);
    }

    public int export(List<MergeDecision> decisions, Writer out) {
        try {
            for (MergeDecision decision : decisions) {
                out.write(toJson(decision));
                out.write('\n');
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export decision log", e);
        }
        log.info("decision_log.exported records={}", decisions.size());
        return decisions.size();
    }

    public String toJson(MergeDecision decision) {
        try {
            return objectMapper.writeValueAsString(toMap(decision));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize decision " + decision.id(), e);
        }
    }

    private static Map<String, Object> toMap(MergeDecision decision) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", decision.id());
        map.put("mentionId", decision.mentionId());
        map.put("surfaceForm", decision.surfaceForm());
        map.put("normalizedKey", decision.normalizedKey());
        map.put("entityType", decision.entityType() != null ? decision.entityType().name() : null);
        map.put("matchedEntityId", decision.matchedEntityLabel());
        map.put("resultEntityId", decision.resultEntityId());
        map.put("score", decision.score());
        map.put("tier", decision.tier().name());
        map.put("reasoning", decision.reasoning());
        map.put("timestamp", decision.timestamp().toString());
        return map;
    }
}

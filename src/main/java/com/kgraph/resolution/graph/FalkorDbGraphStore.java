package com.kgraph.resolution.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * {@link GraphStore} backed by a Cypher {@link GraphConnection} (FalkorDB).
 *
 * <p>Entities are {@code (:Entity {id})} nodes, relations are typed relationships between
 * them, both written with {@code MERGE} so that repeated upserts update in place.
 * Connection-level failures surface as {@link TransientStoreException}.</p>
 */
public class FalkorDbGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(FalkorDbGraphStore.class);

    private final GraphConnection connection;

    public FalkorDbGraphStore(GraphConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
    }

    @Override
    public void upsertNode(int id, Map<String, Object> attributes) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", id);
        String query = "MERGE (e:Entity {id: $id})" + setClause("e", "n_", attributes, params);
        run("upsertNode " + id, () -> {
            connection.execute(query, params);
            return null;
        });
        log.debug("Upserted node {}", id);
    }

    @Override
    public void upsertEdge(int fromId, int toId, String predicate, Map<String, Object> attributes) {
        InputSanitizer.validateRelationshipType(predicate);
        Map<String, Object> params = new HashMap<>();
        params.put("fromId", fromId);
        params.put("toId", toId);
        String query = """
                MATCH (a:Entity {id: $fromId})
                MATCH (b:Entity {id: $toId})
                MERGE (a)-[r:%s]->(b)""".formatted(predicate) + setClause("r", "r_", attributes, params);
        run("upsertEdge " + fromId + "-" + predicate + "->" + toId, () -> {
            connection.execute(query, params);
            return null;
        });
        log.debug("Upserted edge {}-{}->{}", fromId, predicate, toId);
    }

    @Override
    public void removeEdge(int fromId, int toId, String predicate) {
        InputSanitizer.validateRelationshipType(predicate);
        String query = """
                MATCH (a:Entity {id: $fromId})-[r:%s]->(b:Entity {id: $toId})
                DELETE r""".formatted(predicate);
        run("removeEdge " + fromId + "-" + predicate + "->" + toId, () -> {
            connection.execute(query, Map.of("fromId", fromId, "toId", toId));
            return null;
        });
        log.debug("Removed edge {}-{}->{}", fromId, predicate, toId);
    }

    @Override
    public List<GraphNeighbor> query(int nodeId, int depth) {
        if (depth <= 0) {
            return List.of();
        }
        String query = """
                MATCH p = (s:Entity {id: $id})-[*1..%d]-(n:Entity)
                WHERE n.id <> $id
                RETURN n.id AS id, min(length(p)) AS hops
                ORDER BY hops, id""".formatted(depth);
        List<Map<String, Object>> rows = run("query " + nodeId,
                () -> connection.query(query, Map.of("id", nodeId)));
        List<GraphNeighbor> neighbors = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            neighbors.add(new GraphNeighbor(((Number) row.get("id")).intValue(), ((Number) row.get("hops")).intValue()));
        }
        return neighbors;
    }

    @Override
    public boolean containsNode(int id) {
        List<Map<String, Object>> rows = run("containsNode " + id,
                () -> connection.query("MATCH (e:Entity {id: $id}) RETURN count(e) AS c", Map.of("id", id)));
        return !rows.isEmpty() && ((Number) rows.get(0).get("c")).longValue() > 0;
    }

    private static String setClause(String variable, String paramPrefix, Map<String, Object> attributes,
                                    Map<String, Object> params) {
        if (attributes.isEmpty()) {
            return "";
        }
        StringJoiner assignments = new StringJoiner(", ", " SET ", "");
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            InputSanitizer.validatePropertyKey(entry.getKey());
            InputSanitizer.sanitizeForCypher(entry.getValue());
            String param = paramPrefix + entry.getKey();
            assignments.add(variable + "." + entry.getKey() + " = $" + param);
            params.put(param, entry.getValue());
        }
        return assignments.toString();
    }

    private static <T> T run(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            if (hasIoCause(e)) {
                throw new TransientStoreException("Graph store unavailable during " + operation, e);
            }
            throw e;
        }
    }

    private static boolean hasIoCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}

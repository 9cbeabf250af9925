package com.purchasingpower.codegraph.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.Neo4jProperties;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import com.purchasingpower.codegraph.knowledge.GraphStatistics;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Neo4j implementation of GraphStore interface.
 *
 * <p>Nodes are merged on {@code (label, key)} and edges on {@code (source, type, target)}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final Pattern LABEL_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Neo4jProperties neo4jProperties;
    private Driver driver;

    public Neo4jGraphStoreImpl(AppProperties props) {
        this.neo4jProperties = props.getNeo4j();
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore at: {}", neo4jProperties.getUri());
        Config config = Config.builder()
                .withConnectionTimeout(neo4jProperties.getConnectionTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        driver = GraphDatabase.driver(neo4jProperties.getUri(),
                AuthTokens.basic(neo4jProperties.getUsername(), neo4jProperties.getPassword()), config);
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = driver.session()) {
            for (EntityKind kind : EntityKind.values()) {
                String label = kind.getLabel();
                session.run("CREATE INDEX " + label.toLowerCase() + "_key IF NOT EXISTS FOR (n:" + label + ") ON (n.key)");
                session.run("CREATE INDEX " + label.toLowerCase() + "_name IF NOT EXISTS FOR (n:" + label + ") ON (n.name)");
            }
            log.info("✅ Neo4j property indexes created");
        } catch (Exception e) {
            log.warn("⚠️  Failed to create indexes: {}", e.getMessage());
        }
    }

    @Override
    public List<Map<String, Object>> execute(String cypher, Map<String, Object> parameters) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "execute", log);
        ctx.logRequest(ExternalCallLogger.truncate(cypher, 200), "Params", ExternalCallLogger.formatMap(parameters));

        try (Session session = driver.session()) {
            List<Map<String, Object>> rows = session.executeRead(tx -> {
                Result result = tx.run(cypher, parameters == null ? Collections.emptyMap() : parameters);
                List<Map<String, Object>> collected = new ArrayList<>();
                while (result.hasNext()) {
                    Record record = result.next();
                    collected.add(record.asMap());
                }
                return collected;
            });
            ctx.logResponse(rows.size() + " rows");
            return rows;
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new CodeGraphException("Cypher query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void upsertNode(String label, String key, Map<String, Object> properties) {
        String cypher = "MERGE (n:" + checkLabel(label) + " {key: $key}) SET n += $props";

        try (Session session = driver.session()) {
            session.executeWrite(tx -> {
                tx.run(cypher, Map.of("key", key, "props", properties));
                return null;
            });
        }
    }

    @Override
    public void upsertEdge(String sourceKey, String sourceLabel, String targetKey, String targetLabel, RelationshipKind kind) {
        String cypher = """
            MATCH (a:%s {key: $sourceKey})
            MATCH (b:%s {key: $targetKey})
            MERGE (a)-[r:%s]->(b)
            RETURN count(r) AS c
            """.formatted(checkLabel(sourceLabel), checkLabel(targetLabel), kind.name());

        long created;
        try (Session session = driver.session()) {
            created = session.executeWrite(tx -> tx.run(cypher, Map.of("sourceKey", sourceKey, "targetKey", targetKey))
                    .single()
                    .get("c")
                    .asLong());
        }
        if (created == 0) {
            throw new CodeGraphException("Missing endpoint for " + kind + " edge " + sourceLabel + "(" + sourceKey
                    + ") -> " + targetLabel + "(" + targetKey + ")");
        }
    }

    @Override
    public void clearAll() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "clearAll", log);
        ctx.logRequest("MATCH (n) DETACH DELETE n");
        try (Session session = driver.session()) {
            session.executeWrite(tx -> {
                tx.run("MATCH (n) DETACH DELETE n");
                return null;
            });
            ctx.logResponse("Graph cleared");
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new CodeGraphException("Failed to clear graph: " + e.getMessage(), e);
        }
    }

    @Override
    public GraphStatistics getStatistics() {
        GraphStatistics.GraphStatisticsBuilder stats = GraphStatistics.builder();
        try (Session session = driver.session()) {
            session.executeRead(tx -> {
                Result nodes = tx.run("MATCH (n) RETURN labels(n)[0] AS label, count(n) AS count");
                while (nodes.hasNext()) {
                    Record record = nodes.next();
                    if (!record.get("label").isNull()) {
                        stats.nodeCount(record.get("label").asString(), record.get("count").asLong());
                    }
                }
                Result rels = tx.run("MATCH ()-[r]->() RETURN type(r) AS type, count(r) AS count");
                while (rels.hasNext()) {
                    Record record = rels.next();
                    stats.relationshipCount(record.get("type").asString(), record.get("count").asLong());
                }
                return null;
            });
        }
        return stats.build();
    }

    private static String checkLabel(String label) {
        Preconditions.checkArgument(label != null && LABEL_PATTERN.matcher(label).matches(), "Invalid label: %s", label);
        return label;
    }
}

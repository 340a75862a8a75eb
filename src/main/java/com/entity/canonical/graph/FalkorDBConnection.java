package com.entity.canonical.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One JFalkorDB driver bound to one graph. Not thread-safe: the search backend
 * reaches it through a {@link PooledFalkorDBConnection}.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PARAM = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private static final List<String> SYNONYM_SCHEMA = List.of(
            "CREATE INDEX FOR (m:SynonymIndex) ON (m.name)",
            "CREATE INDEX FOR (d:SynonymDoc) ON (d.index)",
            "CREATE INDEX FOR (d:SynonymDoc) ON (d.id)",
            "CREATE INDEX FOR (d:SynonymDoc) ON (d.cname)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.debug("falkordb.connected endpoint={}:{} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        graph.query(render(query, params));
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        ResultSet resultSet = graph.query(render(query, params));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        log.trace("falkordb.query graph={} rows={}", graphName, rows.size());
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("falkordb.ping.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void ensureSynonymSchema() {
        for (String statement : SYNONYM_SCHEMA) {
            try {
                graph.query(statement);
            } catch (RuntimeException e) {
                // FalkorDB rejects re-creating an existing index
                log.debug("falkordb.schema.skipped graph={} statement='{}' reason={}",
                        graphName, statement, e.getMessage());
            }
        }
    }

    private String render(String query, Map<String, Object> params) {
        String rendered = processParams(query, params);
        log.trace("falkordb.statement graph={} cypher={}", graphName, rendered);
        return rendered;
    }

    /**
     * Substitutes $param placeholders with literal values in a single pass, so
     * text inside a substituted value is never treated as a placeholder.
     * Unknown placeholders are left as they are.
     */
    static String processParams(String query, Map<String, Object> params) {
        if (params.isEmpty()) {
            return query;
        }
        Matcher matcher = PARAM.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? formatValue(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : values) {
                joiner.add(formatValue(element));
            }
            return joiner.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.close.failed graph={} error={}", graphName, e.getMessage());
        }
    }
}

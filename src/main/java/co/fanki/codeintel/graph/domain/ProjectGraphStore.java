package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * SQLite-backed store of the project call graph.
 *
 * <p>Captures a persistent "big picture" view of an indexed project:
 * file and method nodes, {@code contains} edges from files to methods,
 * and best-effort {@code calls} edges between methods (see
 * {@link CallGraph}).</p>
 *
 * <p>Rebuild is the only write path and always replaces the whole scope.
 * Every query is scoped, and an unknown scope simply yields zero counts
 * and empty reports: the store cannot tell "never indexed" from "indexed
 * and empty".</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ProjectGraphStore {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectGraphStore.class);

    private static final int MAX_DEPTH = 4;

    private static final int MAX_NEIGHBOR_LIMIT = 200;

    /** Keeps IN lists well below the SQLite parameter limit. */
    private static final int LABEL_CHUNK_SIZE = 500;

    static final String DELETE_EDGES =
            "DELETE FROM edges WHERE project = :project";

    static final String DELETE_NODES =
            "DELETE FROM nodes WHERE project = :project";

    static final String INSERT_NODE = """
            INSERT OR REPLACE INTO nodes (
                project, node_id, kind, label, file_path, signature
            ) VALUES (
                :project, :nodeId, :kind, :label, :filePath, :signature
            )
            """;

    static final String INSERT_EDGE = """
            INSERT OR REPLACE INTO edges (project, src, dst, type)
            VALUES (:project, :src, :dst, :type)
            """;

    /** Count nodes of a kind. Uses: PK (project, node_id) prefix. */
    static final String COUNT_NODES_BY_KIND = """
            SELECT COUNT(*) FROM nodes
            WHERE project = :project AND kind = :kind
            """;

    /** Count call edges. Uses: PK (project, src, dst, type) prefix. */
    static final String COUNT_CALL_EDGES = """
            SELECT COUNT(*) FROM edges
            WHERE project = :project AND type = 'calls'
            """;

    /** Top nodes by out-degree. Uses: idx_edges_src. */
    static final String TOP_CALLERS = """
            SELECT src AS node_id, COUNT(*) AS degree
            FROM edges
            WHERE project = :project AND type = 'calls'
            GROUP BY src
            ORDER BY degree DESC, src ASC
            LIMIT :limit
            """;

    /** Top nodes by in-degree. Uses: idx_edges_dst. */
    static final String TOP_CALLEES = """
            SELECT dst AS node_id, COUNT(*) AS degree
            FROM edges
            WHERE project = :project AND type = 'calls'
            GROUP BY dst
            ORDER BY degree DESC, dst ASC
            LIMIT :limit
            """;

    static final String SAMPLE_CALL_EDGES = """
            SELECT src, dst FROM edges
            WHERE project = :project AND type = 'calls'
            ORDER BY src, dst
            LIMIT :limit
            """;

    /** Outgoing calls of one node. Uses: idx_edges_src. */
    static final String CALLS_FROM = """
            SELECT dst FROM edges
            WHERE project = :project AND type = 'calls' AND src = :nodeId
            ORDER BY dst
            LIMIT :limit
            """;

    /** Incoming calls of one node. Uses: idx_edges_dst. */
    static final String CALLS_TO = """
            SELECT src FROM edges
            WHERE project = :project AND type = 'calls' AND dst = :nodeId
            ORDER BY src
            LIMIT :limit
            """;

    static final String FIND_LABELS = """
            SELECT node_id, label FROM nodes
            WHERE project = :project AND node_id IN (<nodeIds>)
            """;

    static final String FIND_NODE = """
            SELECT * FROM nodes
            WHERE project = :project AND node_id = :nodeId
            """;

    /** Call edges joined to the files of both endpoints. */
    static final String FILE_DEPENDENCIES = """
            SELECT DISTINCT s.file_path AS src_file, d.file_path AS dst_file
            FROM edges e
            JOIN nodes s ON s.project = e.project AND s.node_id = e.src
            JOIN nodes d ON d.project = e.project AND d.node_id = e.dst
            WHERE e.project = :project
              AND e.type = 'calls'
              AND s.file_path IS NOT NULL
              AND d.file_path IS NOT NULL
              AND s.file_path <> d.file_path
            ORDER BY src_file, dst_file
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new ProjectGraphStore.
     *
     * @param theJdbi the JDBI instance bound to the graph database
     */
    public ProjectGraphStore(@Qualifier("graphJdbi") final Jdbi theJdbi) {
        this.jdbi = Preconditions.requireNonNull(theJdbi, "Jdbi is required");
    }

    /**
     * Replaces the graph of a scope with the one computed from a parse.
     *
     * <p>The delete and insert phases run in a single transaction, so a
     * failure midway leaves the previous graph in place.</p>
     *
     * @param scope the project scope to rebuild
     * @param methods the full current set of parsed methods
     * @return the rebuild statistics
     */
    public GraphStats rebuild(final ProjectScope scope,
            final Collection<CodeBlock> methods) {

        Preconditions.requireNonNull(scope, "Scope is required");

        final CallGraph graph = CallGraph.build(scope, methods);
        final String project = scope.storageKey();

        jdbi.useTransaction(handle -> {
            handle.createUpdate(DELETE_EDGES).bind("project", project).execute();
            handle.createUpdate(DELETE_NODES).bind("project", project).execute();
            insertNodes(handle, graph.nodes());
            insertEdges(handle, graph.edges());
        });

        final GraphStats stats = graph.stats();
        LOG.info("Rebuilt graph for {}: files={}, methods={}, calls={},"
                        + " contains={}",
                scope, stats.files(), stats.methods(), stats.callEdges(),
                stats.containsEdges());
        return stats;
    }

    private void insertNodes(final Handle handle, final List<GraphNode> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        final PreparedBatch batch = handle.prepareBatch(INSERT_NODE);
        for (final GraphNode node : nodes) {
            batch.bind("project", node.scope().storageKey())
                    .bind("nodeId", node.nodeId())
                    .bind("kind", node.kind().storageValue())
                    .bind("label", node.label())
                    .bind("filePath", node.filePath())
                    .bind("signature", node.signature())
                    .add();
        }
        batch.execute();
    }

    private void insertEdges(final Handle handle, final List<GraphEdge> edges) {
        if (edges.isEmpty()) {
            return;
        }
        final PreparedBatch batch = handle.prepareBatch(INSERT_EDGE);
        for (final GraphEdge edge : edges) {
            batch.bind("project", edge.scope().storageKey())
                    .bind("src", edge.src())
                    .bind("dst", edge.dst())
                    .bind("type", edge.type().storageValue())
                    .add();
        }
        batch.execute();
    }

    /**
     * Returns a compact human-readable overview of a project graph.
     *
     * <p>Lists totals, the top {@code limit} callers (out-degree), the top
     * {@code limit} callees (in-degree), and up to {@code limit} sample call
     * edges. Ties are broken by node id so the text is reproducible.</p>
     *
     * @param scope the project scope
     * @param limit the maximum entries per section, at least 1
     * @return the overview text
     */
    public String overviewText(final ProjectScope scope, final int limit) {
        Preconditions.requireNonNull(scope, "Scope is required");

        final String project = scope.storageKey();
        final int lim = Math.max(1, limit);

        return jdbi.withHandle(handle -> {
            final long methodCount = countNodes(handle, project, NodeKind.METHOD);
            final long fileCount = countNodes(handle, project, NodeKind.FILE);
            final long callCount = handle.createQuery(COUNT_CALL_EDGES)
                    .bind("project", project)
                    .mapTo(Long.class)
                    .one();

            final List<NodeDegree> topCallers = degrees(handle, TOP_CALLERS,
                    project, lim);
            final List<NodeDegree> topCallees = degrees(handle, TOP_CALLEES,
                    project, lim);
            final List<CallEdge> sample = handle.createQuery(SAMPLE_CALL_EDGES)
                    .bind("project", project)
                    .bind("limit", lim)
                    .map((rs, ctx) -> new CallEdge(rs.getString("src"),
                            rs.getString("dst")))
                    .list();

            final Set<String> ids = new LinkedHashSet<>();
            topCallers.forEach(d -> ids.add(d.nodeId()));
            topCallees.forEach(d -> ids.add(d.nodeId()));
            sample.forEach(e -> {
                ids.add(e.src());
                ids.add(e.dst());
            });
            final Map<String, String> labels = labels(handle, project, ids);

            final List<String> lines = new ArrayList<>();
            lines.add("Project: " + scope.displayName());
            lines.add("Files indexed: " + fileCount);
            lines.add("Methods indexed: " + methodCount);
            lines.add("Call edges (best-effort): " + callCount);

            if (!topCallers.isEmpty()) {
                lines.add("");
                lines.add("Top callers (out-degree):");
                for (final NodeDegree d : topCallers) {
                    lines.add("- " + labelOf(labels, d.nodeId())
                            + " (calls=" + d.degree() + ")");
                }
            }

            if (!topCallees.isEmpty()) {
                lines.add("");
                lines.add("Top callees (in-degree):");
                for (final NodeDegree d : topCallees) {
                    lines.add("- " + labelOf(labels, d.nodeId())
                            + " (called_by=" + d.degree() + ")");
                }
            }

            if (!sample.isEmpty()) {
                lines.add("");
                lines.add("Sample call edges:");
                for (final CallEdge e : sample) {
                    lines.add("- " + render(labels, e));
                }
            }

            return String.join("\n", lines);
        });
    }

    /**
     * Describes the call neighborhood of a node.
     *
     * <p>Runs a bounded breadth-first traversal over {@code calls} edges in
     * both directions. {@code depth} is clamped to [1, 4] and {@code limit}
     * to [1, 200]; the limit bounds each frontier expansion and each output
     * section, not the whole traversal. A node is expanded at most once.</p>
     *
     * @param scope the project scope
     * @param nodeId the node to start from
     * @param depth the traversal depth
     * @param limit the per-expansion fan-out limit
     * @return the neighbors text
     */
    public String neighborsText(final ProjectScope scope, final String nodeId,
            final int depth, final int limit) {

        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonBlank(nodeId, "Node id is required");

        final String project = scope.storageKey();
        final int d = Preconditions.clamp(depth, 1, MAX_DEPTH);
        final int lim = Preconditions.clamp(limit, 1, MAX_NEIGHBOR_LIMIT);

        return jdbi.withHandle(handle -> {
            final Set<String> visited = new HashSet<>();
            visited.add(nodeId);
            TreeSet<String> frontier = new TreeSet<>();
            frontier.add(nodeId);

            final List<CallEdge> outgoing = new ArrayList<>();
            final List<CallEdge> incoming = new ArrayList<>();

            for (int level = 0; level < d && !frontier.isEmpty(); level++) {
                final TreeSet<String> next = new TreeSet<>();
                int expanded = 0;
                for (final String current : frontier) {
                    if (expanded++ >= lim) {
                        break;
                    }
                    for (final String dst : adjacent(handle, CALLS_FROM,
                            project, current, lim)) {
                        outgoing.add(new CallEdge(current, dst));
                        if (visited.add(dst)) {
                            next.add(dst);
                        }
                    }
                    for (final String src : adjacent(handle, CALLS_TO,
                            project, current, lim)) {
                        incoming.add(new CallEdge(src, current));
                        if (visited.add(src)) {
                            next.add(src);
                        }
                    }
                }
                frontier = next;
            }

            final Map<String, String> labels = labels(handle, project, visited);

            final List<String> lines = new ArrayList<>();
            lines.add("Node: " + labelOf(labels, nodeId));
            lines.add("Depth: " + d);

            if (!outgoing.isEmpty()) {
                lines.add("");
                lines.add("Calls:");
                outgoing.stream().limit(lim)
                        .forEach(e -> lines.add("- " + render(labels, e)));
            }

            if (!incoming.isEmpty()) {
                lines.add("");
                lines.add("Called by:");
                incoming.stream().limit(lim)
                        .forEach(e -> lines.add("- " + render(labels, e)));
            }

            return String.join("\n", lines);
        });
    }

    /**
     * Derives file-level dependencies from the call edges.
     *
     * <p>A file depends on another when one of its methods has a call edge
     * to a method of the other file. Same-file pairs are excluded.</p>
     *
     * @param scope the project scope
     * @return map of file path to the sorted, distinct files it depends on
     */
    public Map<String, List<String>> fileDependencies(final ProjectScope scope) {
        Preconditions.requireNonNull(scope, "Scope is required");

        final Map<String, List<String>> dependencies = new LinkedHashMap<>();
        jdbi.useHandle(handle -> handle.createQuery(FILE_DEPENDENCIES)
                .bind("project", scope.storageKey())
                .map((rs, ctx) -> Map.entry(rs.getString("src_file"),
                        rs.getString("dst_file")))
                .forEach(pair -> dependencies
                        .computeIfAbsent(pair.getKey(), k -> new ArrayList<>())
                        .add(pair.getValue())));
        return dependencies;
    }

    /**
     * Finds a single node.
     *
     * @param scope the project scope
     * @param nodeId the node id
     * @return the node if present
     */
    public Optional<GraphNode> findNode(final ProjectScope scope,
            final String nodeId) {
        Preconditions.requireNonNull(scope, "Scope is required");
        return jdbi.withHandle(handle -> handle.createQuery(FIND_NODE)
                .bind("project", scope.storageKey())
                .bind("nodeId", nodeId)
                .map((rs, ctx) -> new GraphNode(
                        ProjectScope.fromStorageKey(rs.getString("project")),
                        rs.getString("node_id"),
                        NodeKind.fromStorageValue(rs.getString("kind")),
                        rs.getString("label"),
                        rs.getString("file_path"),
                        rs.getString("signature")))
                .findOne());
    }

    private static long countNodes(final Handle handle, final String project,
            final NodeKind kind) {
        return handle.createQuery(COUNT_NODES_BY_KIND)
                .bind("project", project)
                .bind("kind", kind.storageValue())
                .mapTo(Long.class)
                .one();
    }

    private static List<NodeDegree> degrees(final Handle handle,
            final String sql, final String project, final int limit) {
        return handle.createQuery(sql)
                .bind("project", project)
                .bind("limit", limit)
                .map((rs, ctx) -> new NodeDegree(rs.getString("node_id"),
                        rs.getLong("degree")))
                .list();
    }

    private static List<String> adjacent(final Handle handle, final String sql,
            final String project, final String nodeId, final int limit) {
        return handle.createQuery(sql)
                .bind("project", project)
                .bind("nodeId", nodeId)
                .bind("limit", limit)
                .mapTo(String.class)
                .list();
    }

    private static Map<String, String> labels(final Handle handle,
            final String project, final Collection<String> nodeIds) {

        final Map<String, String> labels = new HashMap<>();
        final List<String> ids = new ArrayList<>(new LinkedHashSet<>(nodeIds));

        for (int i = 0; i < ids.size(); i += LABEL_CHUNK_SIZE) {
            final List<String> chunk = ids.subList(i,
                    Math.min(i + LABEL_CHUNK_SIZE, ids.size()));
            handle.createQuery(FIND_LABELS)
                    .bind("project", project)
                    .bindList("nodeIds", chunk)
                    .map((rs, ctx) -> Map.entry(rs.getString("node_id"),
                            rs.getString("label")))
                    .forEach(row -> labels.put(row.getKey(), row.getValue()));
        }
        return labels;
    }

    private static String labelOf(final Map<String, String> labels,
            final String nodeId) {
        return labels.getOrDefault(nodeId, nodeId);
    }

    private static String render(final Map<String, String> labels,
            final CallEdge edge) {
        return labelOf(labels, edge.src()) + " -> " + labelOf(labels, edge.dst());
    }

    /** A call edge between two node ids. */
    private record CallEdge(String src, String dst) {}

    /** A node id with its degree in the call subgraph. */
    private record NodeDegree(String nodeId, long degree) {}

}

package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-memory call graph computed from one full parse of a project.
 *
 * <p>Holds the nodes and edges that a rebuild writes for a scope. For
 * every code block it emits a method node, merges a file node for the
 * block's file, and links both with a {@code contains} edge.</p>
 *
 * <p>Call edges are resolved by name only: a recorded call name produces
 * an edge to every other method whose lowercased signature contains the
 * lowercased name. There is no type or overload resolution, so the
 * result may over-match. Self loops are never emitted.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallGraph {

    /** File path used for blocks the parser could not attribute. */
    public static final String UNKNOWN_FILE = "(unknown)";

    private final ProjectScope scope;

    /** Method nodes by node id, in input order. */
    private final Map<String, GraphNode> methodNodes;

    /** File nodes by node id, in first-seen order. */
    private final Map<String, GraphNode> fileNodes;

    private final Set<GraphEdge> containsEdges;

    private final Set<GraphEdge> callEdges;

    private CallGraph(final ProjectScope theScope) {
        this.scope = theScope;
        this.methodNodes = new LinkedHashMap<>();
        this.fileNodes = new LinkedHashMap<>();
        this.containsEdges = new LinkedHashSet<>();
        this.callEdges = new LinkedHashSet<>();
    }

    /**
     * Computes the graph for a scope from its parsed methods.
     *
     * @param scope the project scope the nodes belong to
     * @param methods the full current set of parsed methods
     * @return the computed graph
     */
    public static CallGraph build(final ProjectScope scope,
            final Collection<CodeBlock> methods) {

        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonNull(methods, "Methods are required");

        final CallGraph graph = new CallGraph(scope);

        for (final CodeBlock method : methods) {
            graph.addMethod(method);
        }

        for (final CodeBlock method : methods) {
            graph.resolveCalls(method);
        }

        return graph;
    }

    /**
     * Builds the scoped node id of a method.
     *
     * @param scope the project scope
     * @param methodId the parser-assigned method id
     * @return the node id
     */
    public static String methodNodeId(final ProjectScope scope,
            final String methodId) {
        return scope.qualify(methodId);
    }

    /**
     * Builds the scoped node id of a file.
     *
     * @param scope the project scope
     * @param filePath the file path
     * @return the node id
     */
    public static String fileNodeId(final ProjectScope scope,
            final String filePath) {
        return scope.qualify("file::" + filePath);
    }

    private void addMethod(final CodeBlock method) {
        Preconditions.requireNonBlank(method.id(), "Method id is required");

        final String filePath = fileOf(method);
        final String nodeId = methodNodeId(scope, method.id());
        final String label = isBlank(method.signature())
                ? method.id() : method.signature();

        methodNodes.put(nodeId, new GraphNode(scope, nodeId, NodeKind.METHOD,
                label, filePath, method.signature()));

        final String fileId = fileNodeId(scope, filePath);
        fileNodes.computeIfAbsent(fileId, id -> new GraphNode(scope, id,
                NodeKind.FILE, filePath, filePath, null));

        containsEdges.add(new GraphEdge(scope, fileId, nodeId,
                EdgeType.CONTAINS));
    }

    private void resolveCalls(final CodeBlock method) {
        final String src = methodNodeId(scope, method.id());

        for (final String call : method.calls()) {
            final String callName = call.trim().toLowerCase(Locale.ROOT);
            if (callName.isEmpty()) {
                continue;
            }
            for (final GraphNode candidate : methodNodes.values()) {
                if (candidate.nodeId().equals(src)) {
                    continue;
                }
                final String signature = candidate.signature() == null
                        ? "" : candidate.signature().toLowerCase(Locale.ROOT);
                if (signature.contains(callName)) {
                    callEdges.add(new GraphEdge(scope, src,
                            candidate.nodeId(), EdgeType.CALLS));
                }
            }
        }
    }

    private static String fileOf(final CodeBlock method) {
        return isBlank(method.filePath()) ? UNKNOWN_FILE : method.filePath();
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    /** Returns the scope this graph was built for. */
    public ProjectScope scope() {
        return scope;
    }

    /**
     * Returns all nodes, file nodes first.
     *
     * @return unmodifiable list of nodes
     */
    public List<GraphNode> nodes() {
        final List<GraphNode> all = new ArrayList<>(
                fileNodes.size() + methodNodes.size());
        all.addAll(fileNodes.values());
        all.addAll(methodNodes.values());
        return Collections.unmodifiableList(all);
    }

    /**
     * Returns all edges, contains edges first.
     *
     * @return unmodifiable list of edges
     */
    public List<GraphEdge> edges() {
        final List<GraphEdge> all = new ArrayList<>(
                containsEdges.size() + callEdges.size());
        all.addAll(containsEdges);
        all.addAll(callEdges);
        return Collections.unmodifiableList(all);
    }

    /** Returns the distinct call edges. */
    public Set<GraphEdge> callEdges() {
        return Collections.unmodifiableSet(callEdges);
    }

    /** Returns the distinct contains edges. */
    public Set<GraphEdge> containsEdges() {
        return Collections.unmodifiableSet(containsEdges);
    }

    /**
     * Summarizes the graph as rebuild statistics.
     *
     * @return the counts of files, methods and edges
     */
    public GraphStats stats() {
        return new GraphStats(scope, fileNodes.size(), methodNodes.size(),
                callEdges.size(), containsEdges.size());
    }

}

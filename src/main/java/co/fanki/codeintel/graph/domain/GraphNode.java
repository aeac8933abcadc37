package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;

/**
 * A node of the project call graph.
 *
 * <p>Identified by {@code (scope, nodeId)}. Method nodes carry their
 * signature; file nodes use the file path as label and have no
 * signature.</p>
 *
 * @param scope the project partition
 * @param nodeId the node id, unique within the scope
 * @param kind the node kind
 * @param label the display label (signature, id, or path)
 * @param filePath the file the node belongs to, may be null
 * @param signature the method signature, null for files
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphNode(
        ProjectScope scope,
        String nodeId,
        NodeKind kind,
        String label,
        String filePath,
        String signature) {

    public GraphNode {
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonBlank(nodeId, "Node id is required");
        Preconditions.requireNonNull(kind, "Node kind is required");
        Preconditions.requireNonNull(label, "Label is required");
    }

    /** Checks if this node is a method node. */
    public boolean isMethod() {
        return kind == NodeKind.METHOD;
    }

}

package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;

/**
 * A directed edge of the project call graph.
 *
 * <p>Edges have set semantics: two edges with the same scope, endpoints
 * and type are the same edge.</p>
 *
 * @param scope the project partition
 * @param src the source node id
 * @param dst the destination node id
 * @param type the edge type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphEdge(ProjectScope scope, String src, String dst,
        EdgeType type) {

    public GraphEdge {
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonBlank(src, "Edge source is required");
        Preconditions.requireNonBlank(dst, "Edge destination is required");
        Preconditions.requireNonNull(type, "Edge type is required");
    }

}

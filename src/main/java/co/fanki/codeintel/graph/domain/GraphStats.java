package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.ProjectScope;

/**
 * Result of a graph rebuild.
 *
 * @param project the rebuilt project scope
 * @param files the number of distinct files
 * @param methods the number of distinct methods
 * @param callEdges the number of distinct call edges
 * @param containsEdges the number of distinct contains edges
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphStats(
        ProjectScope project,
        int files,
        int methods,
        int callEdges,
        int containsEdges) {
}

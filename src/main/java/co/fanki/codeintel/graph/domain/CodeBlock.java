package co.fanki.codeintel.graph.domain;

import java.util.List;
import java.util.Objects;

/**
 * A parsed method/function record emitted by the source parser.
 *
 * <p>This is the only input shape accepted by the graph store. The
 * {@code calls} list holds plain identifiers of invoked methods, with no
 * type or overload information.</p>
 *
 * @param id the method id, unique within a project
 * @param signature the display signature, may be null
 * @param calls the names of invoked methods, may be null
 * @param filePath the source file path, may be null
 * @param project the project name, may be null for unscoped parses
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CodeBlock(
        String id,
        String signature,
        List<String> calls,
        String filePath,
        String project) {

    public CodeBlock {
        calls = calls == null ? List.of()
                : calls.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Returns a copy of this block assigned to another project.
     *
     * @param theProject the project name
     * @return the reassigned block
     */
    public CodeBlock withProject(final String theProject) {
        return new CodeBlock(id, signature, calls, filePath, theProject);
    }

}

package co.fanki.codeintel.graph.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Port to the source parser that turns a directory into code blocks.
 *
 * <p>Implemented outside this module (tree-sitter based parsers).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface CodeBlockScanner {

    /**
     * Scans and parses every supported source file under a directory.
     *
     * @param directory the root directory
     * @param excludeTests whether test sources are skipped
     * @return the parsed method/function records, never null
     */
    List<CodeBlock> scan(Path directory, boolean excludeTests);

}

package co.fanki.codeintel.graph.domain;

import java.util.List;

/**
 * Port to the embedding-backed similarity index.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface VectorIndex {

    /**
     * Indexes code blocks as retrievable documents.
     *
     * @param blocks the blocks to index
     */
    void indexCodeBlocks(List<CodeBlock> blocks);

    /**
     * Indexes one summary document per file.
     *
     * @param blocks the blocks whose files are summarized
     */
    void indexFileSummaries(List<CodeBlock> blocks);

    /** Flushes pending documents to durable storage. */
    void persist();

}

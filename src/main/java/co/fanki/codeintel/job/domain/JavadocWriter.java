package co.fanki.codeintel.job.domain;

/**
 * Writes a JavaDoc block for one undocumented declaration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface JavadocWriter {

    /**
     * Produces the documentation of a declaration.
     *
     * @param signature the declaration signature
     * @param memberType one of class, interface, enum, record, method or
     *                   constructor
     * @param code the source of the declaration, possibly truncated
     * @return the raw writer output, expected to contain a {@code /** *\/}
     *         block
     */
    String write(String signature, String memberType, String code);

}

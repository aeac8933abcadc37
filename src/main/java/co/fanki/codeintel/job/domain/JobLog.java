package co.fanki.codeintel.job.domain;

/**
 * Content of a job audit log.
 *
 * @param fileName the log file name
 * @param content the full text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record JobLog(String fileName, String content) {
}

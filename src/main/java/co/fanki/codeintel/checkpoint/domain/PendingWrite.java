package co.fanki.codeintel.checkpoint.domain;

/**
 * A channel update proposed by a task, not yet folded into a checkpoint.
 *
 * @param taskId the task that proposed the write
 * @param channel the target channel
 * @param value the proposed value, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PendingWrite(String taskId, String channel, Object value) {
}

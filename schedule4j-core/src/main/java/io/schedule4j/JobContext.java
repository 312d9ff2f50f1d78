package io.schedule4j;

import io.schedule4j.core.TriggerType;

import java.time.Instant;

/**
 * Input handed to {@link JobHandler#run}.
 *
 * @param taskId      the job being executed
 * @param handlerId   the handler id the job references
 * @param now         the scheduler's notion of "now" for this tick
 * @param config      the job configuration converted to {@link JobHandler#configClass()}
 * @param triggerType whether the run came from a tick or a manual request
 */
public record JobContext<C>(
        String taskId,
        String handlerId,
        Instant now,
        C config,
        TriggerType triggerType
) {
}

package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.CollaboratorException;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.scheduler.TaskHandler;
import com.xendex.backend.scheduler.TaskOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the touch-1 drafting pass for a sequence. Partial failures throw so the task is retried;
 * the pass skips drafts that already exist, so the retry picks up where it stopped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DraftingPassTaskHandler implements TaskHandler {

    private final DraftingService draftingService;

    @Override
    public TaskType getTaskType() {
        return TaskType.DRAFTING_PASS;
    }

    @Override
    public TaskOutcome handle(ScheduledTask task) {
        Long sequenceId = task.getPayload().getSequenceId();
        DraftingPassResult result;
        try {
            result = draftingService.runDraftingPass(sequenceId);
        } catch (ResourceNotFoundException e) {
            log.info("Sequence {} was deleted before its drafting pass ran", sequenceId);
            return TaskOutcome.aborted("sequence_missing");
        }
        if (result.failed() > 0) {
            throw new CollaboratorException(result.failed() + " draft(s) failed for sequence "
                    + sequenceId);
        }
        return TaskOutcome.completed(result.created() + " drafts created");
    }
}

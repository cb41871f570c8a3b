package me.golemcore.support.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Status of a submitted chat task as seen by a poller.
 */
@Data
@Builder
public class ChatTaskStatus {

    public enum State {
        PENDING, SUCCESS, FAILURE
    }

    private String taskId;
    private State state;
    private TurnResult result;
    private String reason;
    private Instant submittedAt;
    private Instant finishedAt;

    public static ChatTaskStatus pending(String taskId, Instant submittedAt) {
        return ChatTaskStatus.builder()
                .taskId(taskId)
                .state(State.PENDING)
                .submittedAt(submittedAt)
                .build();
    }

    public boolean isDone() {
        return state != State.PENDING;
    }
}

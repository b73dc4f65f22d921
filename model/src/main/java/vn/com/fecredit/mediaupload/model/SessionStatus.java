package vn.com.fecredit.mediaupload.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a chunked upload session.
 *
 * <p>
 * Normal flow is {@code PENDING -> IN_PROGRESS -> MERGING -> COMPLETED}. A merge that
 * hits a retryable problem falls back from {@code MERGING} to {@code IN_PROGRESS}.
 * Any non-terminal state may move to {@code FAILED} or {@code EXPIRED}.
 * {@code COMPLETED}, {@code FAILED} and {@code EXPIRED} are terminal.
 */
public enum SessionStatus {
    PENDING,
    IN_PROGRESS,
    MERGING,
    COMPLETED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }

    /**
     * @return {@code true} if chunks may still be written in this state
     */
    public boolean acceptsChunks() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public boolean canTransitionTo(SessionStatus next) {
        return allowedTargets().contains(next);
    }

    private Set<SessionStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(IN_PROGRESS, FAILED, EXPIRED);
            case IN_PROGRESS:
                return EnumSet.of(MERGING, FAILED, EXPIRED);
            case MERGING:
                return EnumSet.of(IN_PROGRESS, COMPLETED, FAILED, EXPIRED);
            default:
                return EnumSet.noneOf(SessionStatus.class);
        }
    }

    public static Set<SessionStatus> nonTerminal() {
        return EnumSet.of(PENDING, IN_PROGRESS, MERGING);
    }

    public static Set<SessionStatus> terminal() {
        return EnumSet.of(COMPLETED, FAILED, EXPIRED);
    }
}

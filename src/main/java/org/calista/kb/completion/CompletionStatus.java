package org.calista.kb.completion;

/**
 * Where the last completion run left the engine.
 */
public enum CompletionStatus {
    /** No run attempted yet. */
    NOT_STARTED,
    /** Pending stack empty and confluence confirmed. */
    CONFLUENT,
    /** A rule-count or overlap-length bound was in force; confluence not claimed. */
    BOUNDED,
    /** Stopped by request, time budget or predicate; resumable. */
    INTERRUPTED,
    /** Idle without any of the above (e.g. rules added after a finished run). */
    INCOMPLETE
}

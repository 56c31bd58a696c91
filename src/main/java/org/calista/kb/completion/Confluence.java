package org.calista.kb.completion;

/** Cached result of the confluence check; reset to UNKNOWN on every active-set mutation. */
public enum Confluence {
    UNKNOWN,
    CONFLUENT,
    NOT_CONFLUENT
}

package org.calista.kb.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class KBEvent {
    public static final String RUN_START = "RUN_START";
    public static final String RUN_STOP = "RUN_STOP";
    public static final String SNAPSHOT = "SNAPSHOT";

    public String type;        // RUN_START, RUN_STOP, SNAPSHOT
    public long tsEpochMs;
    public String runId;
    public String text;        // status, rule counts, file name

    public static KBEvent of(String type, String runId, String text, long tsEpochMs) {
        KBEvent e = new KBEvent();
        e.type = type;
        e.runId = runId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}

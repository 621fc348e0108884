package com.voicerelay.gateway.run;

/**
 * One upstream agent turn. Mutated only under the tracker's mutex.
 */
final class Run {

    final String taskId;
    final String requestId;   // null for runs started by the gateway itself

    private String runId;
    private String text = "";

    Run(String taskId, String requestId) {
        this.taskId    = taskId;
        this.requestId = requestId;
    }

    String runId() { return runId; }

    void bindRunId(String runId) { this.runId = runId; }

    String text() { return text; }

    /** Latest snapshot wins; the gateway resends the full text each tick. */
    void replaceText(String text) { this.text = text; }
}

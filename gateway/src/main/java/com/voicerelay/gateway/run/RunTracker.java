package com.voicerelay.gateway.run;

import com.voicerelay.gateway.broadcast.Broadcaster;
import com.voicerelay.gateway.session.SessionKeyspace;
import com.voicerelay.protocol.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rebuilds one assistant turn out of the streamed {@code agent} events of a run
 * and exposes it under a locally issued task id.
 *
 * Two-phase registration, two key spaces:
 *   chat.send issued       → placeholder in {@code byRequestId}
 *   ack carries runId      → moved to {@code byRunId} (one step, under the mutex)
 *   lifecycle/start for an unknown run in the current session
 *                          → adopted straight into {@code byRunId}
 *
 * Per run: assistant text replaces the snapshot; lifecycle/end publishes a
 * {@link TaskResult} and forgets the run. An ack for a run that already ended
 * drops its placeholder. Runs that never end stay until {@link #clear()}.
 */
public final class RunTracker {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    /** Published when a run ends without any assistant text. */
    public static final String EMPTY_RESULT_TEXT = "Task completed";

    private static final int RECENTLY_ENDED_LIMIT = 256;

    private final Object          mutex;
    private final SessionKeyspace keyspace;
    private final Broadcaster     broadcaster;

    private final Map<String, Run> byRequestId = new HashMap<>();
    private final Map<String, Run> byRunId     = new HashMap<>();

    // Run ids that already published, so a late ack does not park a run that never ends
    private final Set<String> recentlyEnded = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > RECENTLY_ENDED_LIMIT;
        }
    });

    public RunTracker(Object mutex, SessionKeyspace keyspace, Broadcaster broadcaster) {
        this.mutex       = mutex;
        this.keyspace    = keyspace;
        this.broadcaster = broadcaster;
    }

    // ── Registration ─────────────────────────────────────────────────────────

    /** Park an empty run for a turn-initiating request; returns its task id. */
    public String registerPlaceholder(String requestId) {
        Run run = new Run(newTaskId("task"), requestId);
        synchronized (mutex) {
            byRequestId.put(requestId, run);
        }
        return run.taskId;
    }

    /** The request failed, timed out or was abandoned: no run will follow. */
    public void discardPlaceholder(String requestId) {
        synchronized (mutex) {
            byRequestId.remove(requestId);
        }
    }

    /**
     * The gateway acknowledged {@code requestId}. Re-key the placeholder under
     * {@code runId}; an acknowledgement without one leaves nothing to track.
     *
     * If the run was already adopted from an early lifecycle/start, the caller's
     * task id is kept (the adopted id was never handed out) along with any
     * text streamed so far.
     */
    public void onAcknowledged(String requestId, String runId) {
        synchronized (mutex) {
            Run run = byRequestId.remove(requestId);
            if (run == null) return;
            if (runId == null) {
                log.debug("Ack for {} carried no runId, dropping placeholder {}", requestId, run.taskId);
                return;
            }
            if (recentlyEnded.contains(runId)) {
                log.info("Ack for {} arrived after run {} ended, dropping placeholder {}", requestId, runId, run.taskId);
                return;
            }
            Run adopted = byRunId.get(runId);
            if (adopted != null && run.text().isEmpty()) {
                run.replaceText(adopted.text());
            }
            run.bindRunId(runId);
            byRunId.put(run.runId(), run);
        }
        log.debug("Run {} bound to task for request {}", runId, requestId);
    }

    // ── Streaming ────────────────────────────────────────────────────────────

    public void onAgentEvent(AgentEvent event) {
        TaskResult result = null;
        String origin = null;
        synchronized (mutex) {
            Run run = byRunId.get(event.runId());
            if (run == null) {
                if (!event.isLifecycleStart() || !keyspace.matches(event.sessionKey())) {
                    log.trace("Ignoring {} event for untracked run {}", event.stream(), event.runId());
                    return;
                }
                run = new Run(newTaskId("subtask"), null);
                run.bindRunId(event.runId());
                byRunId.put(event.runId(), run);
                log.info("Adopted gateway-initiated run {} as task {}", event.runId(), run.taskId);
            }

            switch (event.stream()) {
                case ASSISTANT -> {
                    String text = event.text();
                    if (!text.isEmpty()) run.replaceText(text);
                }
                case LIFECYCLE -> {
                    if (event.isLifecycleEnd()) {
                        byRunId.remove(event.runId());
                        recentlyEnded.add(event.runId());
                        origin = run.requestId != null ? run.requestId : "gateway";
                        result = new TaskResult(run.taskId, run.text().isEmpty() ? EMPTY_RESULT_TEXT : run.text());
                    }
                }
                default -> { }
            }
        }

        if (result != null) {
            int delivered = broadcaster.publish(result);
            log.info("Run {} ({}) finished as task {} ({} chars, {} listeners)",
                    event.runId(), origin, result.taskId(), result.text().length(), delivered);
        }
    }

    // ── Reset / inspection ───────────────────────────────────────────────────

    /** Forget every run, placeholders included. Returns how many were dropped. */
    public int clear() {
        synchronized (mutex) {
            int dropped = byRequestId.size() + byRunId.size();
            byRunId.clear();
            byRequestId.clear();
            recentlyEnded.clear();
            return dropped;
        }
    }

    public int size() {
        synchronized (mutex) {
            return byRequestId.size() + byRunId.size();
        }
    }

    public boolean hasPlaceholder(String requestId) {
        synchronized (mutex) {
            return byRequestId.containsKey(requestId);
        }
    }

    /** Task id bound to {@code runId}, or null if the run is not tracked. */
    public String taskIdForRun(String runId) {
        synchronized (mutex) {
            Run run = byRunId.get(runId);
            return run != null ? run.taskId : null;
        }
    }

    /** Latest text snapshot of {@code runId}, or null if the run is not tracked. */
    public String textForRun(String runId) {
        synchronized (mutex) {
            Run run = byRunId.get(runId);
            return run != null ? run.text() : null;
        }
    }

    private static String newTaskId(String prefix) {
        return prefix + "_" + System.currentTimeMillis() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }
}

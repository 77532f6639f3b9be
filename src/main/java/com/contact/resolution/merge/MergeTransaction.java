package com.contact.resolution.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction around one contact write.
 * Each step registers the action that undoes it; if a later step throws, or the
 * transaction closes without {@link #markSuccess()}, the registered actions run in
 * reverse order so the store never keeps a partially applied merge.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction("contact:" + id)) {
 *     tx.execute("persist contact", () -> store.persist(merged), () -> store.persist(previous));
 *     tx.execute("link event", () -> events.upsert(e, id), () -> events.remove(e.key()));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final String scope;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    public MergeTransaction(String scope) {
        this.scope = scope;
    }

    /**
     * Runs a step and registers its compensation. On failure, every earlier step is
     * compensated and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        ensureOpen();
        try {
            log.debug("tx.step scope={} step=\"{}\"", scope, description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("tx.step.failed scope={} step=\"{}\" error={}", scope, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Runs an append-only step (audit, review filing) that has nothing to undo.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        ensureOpen();
        try {
            log.debug("tx.step scope={} step=\"{}\" compensable=false", scope, description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("tx.step.failed scope={} step=\"{}\" error={}", scope, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("tx.rollback scope={} steps={}", scope, compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction " + scope + " is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("tx.compensate scope={} step=\"{}\"", scope, action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                // best-effort: keep undoing the remaining steps
                log.error("tx.compensate.failed scope={} step=\"{}\" error={}",
                        scope, action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}

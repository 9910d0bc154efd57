package com.catalog.quality.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Multi-step write with compensations. Completed steps are undone in reverse order when a
 * later step throws or when the transaction closes without {@link #commit()}.
 *
 * <pre>
 * try (StoreTransaction tx = new StoreTransaction("merge group 7")) {
 *     tx.step("deactivate 12", () -> db.update(inactive), () -> db.update(original));
 *     tx.step("mark merged", () -> store.updateGroup(merged), () -> store.updateGroup(group));
 *     tx.commit();
 * }
 * </pre>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final String name;
    private final Deque<Step> undo = new ArrayDeque<>();
    private boolean committed;
    private boolean closed;

    public StoreTransaction(String name) {
        this.name = name;
    }

    /**
     * Runs a step and remembers how to undo it. If the step throws, earlier steps are undone
     * and the exception propagates.
     */
    public void step(String description, Runnable action, Runnable compensation) {
        if (closed || committed) {
            throw new IllegalStateException("Transaction '" + name + "' is finished");
        }
        try {
            action.run();
            undo.push(new Step(description, compensation));
        } catch (RuntimeException e) {
            log.warn("store.tx.step.failed tx={} step={} error={}", name, description, e.getMessage());
            rollback();
            throw e;
        }
    }

    public void commit() {
        committed = true;
        undo.clear();
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (!closed && !committed && !undo.isEmpty()) {
            log.warn("store.tx.rollback tx={} steps={}", name, undo.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        while (!undo.isEmpty()) {
            Step step = undo.pop();
            try {
                step.compensation().run();
            } catch (RuntimeException e) {
                // keep undoing the remaining steps
                log.error("store.tx.compensation.failed tx={} step={} error={}", name, step.description(), e.getMessage());
            }
        }
    }

    private record Step(String description, Runnable compensation) {
    }
}

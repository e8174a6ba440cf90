package com.landscape.connect.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Compensating unit of work for in-memory state that has no transactional store of its own.
 * Each step registers an undo action; undo actions run in reverse order if a step fails or
 * the unit is closed without {@link #markSuccess()}.
 *
 * <pre>
 * try (CompensatingTransaction tx = new CompensatingTransaction("admit 42")) {
 *     tx.execute("add node", () -> addNode(id), () -> removeNode(id));
 *     double d = tx.compute("distance", () -> cache.getOrCompute(a, b), v -> cache.discard(pair));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class CompensatingTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTransaction.class);

    private final String name;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    public CompensatingTransaction(String name) {
        this.name = name;
    }

    /**
     * Runs a step and registers its undo action.
     * If the step fails, registered undo actions run in reverse order and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        ensureOpen();
        try {
            log.trace("unit.step unit={} step={}", name, description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("unit.stepFailed unit={} step={} error={}", name, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Computes a value and registers an undo action that receives it.
     */
    public <T> T compute(String description, Supplier<T> operation, Consumer<T> compensation) {
        ensureOpen();
        try {
            log.trace("unit.step unit={} step={}", name, description);
            T value = operation.get();
            compensationStack.push(new CompensatingAction(description, () -> compensation.accept(value)));
            return value;
        } catch (RuntimeException e) {
            log.warn("unit.stepFailed unit={} step={} error={}", name, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Registers an undo action for work already done outside this unit.
     */
    public void onRollback(String description, Runnable compensation) {
        ensureOpen();
        compensationStack.push(new CompensatingAction(description, compensation));
    }

    /**
     * Marks the unit as successful. Undo actions will not run on close.
     */
    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public int stepCount() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.debug("unit.rollingBack unit={} steps={}", name, compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Unit of work '" + name + "' is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("unit.compensationFailed unit={} step={} error={}",
                        name, action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}

package com.zzf.toolhost.mcp.gate;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 跨会话互斥门. At most one WRITE and one EXECUTE call run at any time across every
 * session sharing this instance; READ calls pass straight through.
 */
@Slf4j
public class ConcurrencyGate {

    private final ToolClassificationTable classification;
    private final Map<ToolAccessClass, Semaphore> gates = new EnumMap<>(ToolAccessClass.class);

    public ConcurrencyGate(ToolClassificationTable classification) {
        this.classification = classification;
        gates.put(ToolAccessClass.WRITE, new Semaphore(1, true));
        gates.put(ToolAccessClass.EXECUTE, new Semaphore(1, true));
    }

    public ToolAccessClass classify(String toolName) {
        return classification.classify(toolName);
    }

    /**
     * Runs {@code action} holding the gate for the tool's class, blocking until it is free.
     */
    public <T> T run(String toolName, Callable<T> action) throws Exception {
        ToolAccessClass cls = classify(toolName);
        Semaphore gate = gates.get(cls);
        if (gate == null) {
            return action.call();
        }
        long t0 = System.nanoTime();
        gate.acquire();
        long waitedMs = (System.nanoTime() - t0) / 1_000_000L;
        if (waitedMs > 0) {
            log.debug("gate.acquired tool={} class={} waitedMs={}", toolName, cls, waitedMs);
        }
        try {
            return action.call();
        } finally {
            gate.release();
        }
    }

    /**
     * Like {@link #run(String, Callable)} but gives up after {@code timeout}.
     *
     * @throws GateTimeoutException if the gate could not be acquired in time
     */
    public <T> T tryRun(String toolName, Duration timeout, Callable<T> action) throws Exception {
        ToolAccessClass cls = classify(toolName);
        Semaphore gate = gates.get(cls);
        if (gate == null) {
            return action.call();
        }
        if (!gate.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new GateTimeoutException(toolName, cls, timeout);
        }
        try {
            return action.call();
        } finally {
            gate.release();
        }
    }

    public boolean isBusy(ToolAccessClass cls) {
        Semaphore gate = gates.get(cls);
        return gate != null && gate.availablePermits() == 0;
    }

    public int queueLength(ToolAccessClass cls) {
        Semaphore gate = gates.get(cls);
        return gate == null ? 0 : gate.getQueueLength();
    }
}

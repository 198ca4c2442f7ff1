package com.zzf.toolhost.mcp.server;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 诊断输出环形缓冲, 满了丢最旧的行.
 */
public class DiagnosticBuffer implements DiagnosticSink {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<String> lines;
    private long dropped;

    public DiagnosticBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public DiagnosticBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(Math.min(capacity, 64));
    }

    @Override
    public synchronized void accept(String line) {
        if (line == null) {
            return;
        }
        if (lines.size() == capacity) {
            lines.pollFirst();
            dropped++;
        }
        lines.addLast(line);
    }

    public synchronized List<String> snapshot() {
        return new ArrayList<>(lines);
    }

    public synchronized long getDropped() {
        return dropped;
    }
}

package com.deepansh.codeagent.observability;

import com.deepansh.codeagent.model.ToolErrorKind;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable per-run context for collecting observability data.
 * Created at the start of each run, populated throughout, logged at the end.
 *
 * Tool records arrive from worker threads, so writes are synchronized.
 * Kept separate from AgentState so observability does not bleed into the loop.
 */
@Slf4j
public class RunContext {

    @Getter
    private final String sessionId;
    private final long startTimeMs = System.currentTimeMillis();
    private final AtomicInteger modelCalls = new AtomicInteger();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    public RunContext(String sessionId) {
        this.sessionId = sessionId;
    }

    public void recordModelCall() {
        modelCalls.incrementAndGet();
    }

    public synchronized void recordToolCall(String toolName, long latencyMs, ToolErrorKind errorKind) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, errorKind));
    }

    public int modelCalls() {
        return modelCalls.get();
    }

    public synchronized List<ToolCallRecord> toolCallRecords() {
        return List.copyOf(toolCallRecords);
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    /** Error count per kind, for the run summary */
    public synchronized Map<ToolErrorKind, Integer> toolErrors() {
        Map<ToolErrorKind, Integer> counts = new TreeMap<>();
        for (ToolCallRecord record : toolCallRecords) {
            if (record.errorKind() != null) {
                counts.merge(record.errorKind(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public void logSummary(String outcome, int steps) {
        List<ToolCallRecord> records = toolCallRecords();
        long toolMs = records.stream().mapToLong(ToolCallRecord::latencyMs).sum();
        log.info("Run summary [session={}, outcome={}, steps={}, modelCalls={}, toolCalls={}, toolMs={}, errors={}, latency={}ms]",
                sessionId, outcome, steps, modelCalls(), records.size(), toolMs, toolErrors(), elapsedMs());
    }

    public record ToolCallRecord(
            String toolName,
            long latencyMs,
            ToolErrorKind errorKind
    ) {}
}

package com.server.skillsync.match.pipeline;

/**
 * 一轮对账的统计
 */
public record ReconciliationReport(
        boolean executed,     // 未拿到锁时为 false
        int triggerCount,
        int succeededCount,
        int failedCount,
        int createdMatchCount
) {
    public static ReconciliationReport skipped() {
        return new ReconciliationReport(false, 0, 0, 0, 0);
    }
}

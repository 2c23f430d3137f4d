package dev.autoapply.model;

import dev.autoapply.entity.QueueStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Entry counts per status.
 */
public record QueueStats(
        long pending,
        long processing,
        long completed,
        long failed,
        long skipped,
        long standby) {

    public static QueueStats fromCounts(Map<QueueStatus, Long> counts) {
        Map<QueueStatus, Long> c = new EnumMap<>(QueueStatus.class);
        c.putAll(counts);
        return new QueueStats(
                c.getOrDefault(QueueStatus.PENDING, 0L),
                c.getOrDefault(QueueStatus.PROCESSING, 0L),
                c.getOrDefault(QueueStatus.COMPLETED, 0L),
                c.getOrDefault(QueueStatus.FAILED, 0L),
                c.getOrDefault(QueueStatus.SKIPPED, 0L),
                c.getOrDefault(QueueStatus.STANDBY, 0L));
    }

    public long total() {
        return pending + processing + completed + failed + skipped + standby;
    }
}

package com.newsrelay.service.runtime;

import java.time.Duration;

/**
 * Counts for one poll cycle of a source group. {@code error} is set only when the cycle
 * was aborted by an unexpected exception.
 */
public record CycleReport(
        String groupName,
        int fetched,
        int queued,
        int delivered,
        int failed,
        Duration duration,
        String error
) {
    public static CycleReport aborted(String groupName, String error) {
        return new CycleReport(groupName, 0, 0, 0, 0, Duration.ZERO, error);
    }

    public boolean completed() {
        return error == null;
    }
}

package com.security.subgraph.exception;

/**
 * 时间早于 1970-01-01T00:00:00Z
 */
public class TimestampRangeException extends InvalidTimestampException {

    private final long epochMillis;

    public TimestampRangeException(String timestamp, long epochMillis) {
        super("时间戳为负数: " + timestamp + " -> " + epochMillis, timestamp);
        this.epochMillis = epochMillis;
    }

    public long getEpochMillis() {
        return epochMillis;
    }
}

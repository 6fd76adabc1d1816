package com.security.subgraph.util;

import com.security.subgraph.constants.SubgraphConstants;
import com.security.subgraph.exception.InvalidTimestampException;
import com.security.subgraph.exception.TimestampFormatException;
import com.security.subgraph.exception.TimestampRangeException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * 时间工具类
 * 使用 Java 8+ 的 DateTimeFormatter（线程安全）
 */
public final class TimeUtil {

    private static final DateTimeFormatter UTC_TIME_FORMATTER = DateTimeFormatter
            .ofPattern(SubgraphConstants.Time.UTC_TIME_FORMAT)
            .withResolverStyle(ResolverStyle.STRICT);

    private TimeUtil() {
    }

    /**
     * 将 Sysmon UTC 时间字符串转换为 epoch 毫秒
     *
     * 字符串总是 UTC，不做时区调整
     *
     * @param utcTime 形如 2017-04-28 22:08:22.025
     * @return epoch 毫秒
     * @throws TimestampFormatException 格式不匹配
     * @throws TimestampRangeException 时间早于 1970 年
     */
    public static long utcToEpochMillis(String utcTime) throws InvalidTimestampException {
        if (utcTime == null || utcTime.isEmpty()) {
            throw new TimestampFormatException(String.valueOf(utcTime));
        }

        LocalDateTime dateTime;
        try {
            dateTime = LocalDateTime.parse(utcTime, UTC_TIME_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new TimestampFormatException(utcTime, e);
        }

        long epochMillis = dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
        if (epochMillis < 0) {
            throw new TimestampRangeException(utcTime, epochMillis);
        }
        return epochMillis;
    }
}

package com.security.subgraph.decoder;

import com.security.subgraph.exception.DecodeException;
import com.security.subgraph.model.event.TelemetryEvent;

/**
 * 单条原始记录到遥测事件的解析器
 *
 * 实现必须线程安全，批处理会并发调用
 */
@FunctionalInterface
public interface TelemetryEventDecoder {

    TelemetryEvent decode(String record) throws DecodeException;
}

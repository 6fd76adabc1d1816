package com.security.subgraph.model.event;

import lombok.Getter;
import lombok.Setter;

/**
 * 网络连接事件（Sysmon EventID 3）
 *
 * Sysmon 中 source 一侧总是本机，Initiated 决定方向
 */
@Getter
@Setter
public abstract class NetworkEvent extends TelemetryEvent {
    private long processId;
    private String image;
    private String protocol;
    private String sourceHostname;
    private int sourcePort;
    private String destinationHostname;
    private int destinationPort;

    NetworkEvent() {
    }
}

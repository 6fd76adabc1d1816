package com.security.subgraph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.subgraph.model.event.*;
import com.security.subgraph.model.graph.GeneratedSubgraphs;
import com.security.subgraph.model.graph.GraphFragment;
import com.security.subgraph.model.graph.GraphNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试数据构造
 */
public final class TelemetryFixtures {

    public static final String COMPUTER = "DESKTOP-7GQ2K1";
    public static final String UTC_TIME = "2017-04-28 22:08:22.025";
    public static final long UTC_TIME_MILLIS = 1493417302025L;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TelemetryFixtures() {
    }

    public static ProcessCreateEvent processCreate() {
        ProcessCreateEvent event = new ProcessCreateEvent();
        event.setComputer(COMPUTER);
        event.setUtcTime(UTC_TIME);
        event.setProcessId(3912);
        event.setParentProcessId(2040);
        event.setImage("C:\\Windows\\System32\\cmd.exe");
        event.setCommandLine("cmd.exe /c whoami");
        return event;
    }

    public static FileCreateEvent fileCreate() {
        FileCreateEvent event = new FileCreateEvent();
        event.setComputer(COMPUTER);
        event.setUtcTime("2017-04-28 22:08:23.000");
        event.setCreationUtcTime(UTC_TIME);
        event.setProcessId(3912);
        event.setImage("C:\\Windows\\System32\\cmd.exe");
        event.setTargetFilename("C:\\Users\\admin\\AppData\\Local\\Temp\\payload.dll");
        return event;
    }

    public static InboundNetworkEvent inbound(String destinationHost) {
        InboundNetworkEvent event = new InboundNetworkEvent();
        fillNetwork(event, destinationHost);
        return event;
    }

    public static OutboundNetworkEvent outbound(String destinationHost) {
        OutboundNetworkEvent event = new OutboundNetworkEvent();
        fillNetwork(event, destinationHost);
        return event;
    }

    private static void fillNetwork(NetworkEvent event, String destinationHost) {
        event.setComputer(COMPUTER);
        event.setUtcTime(UTC_TIME);
        event.setProcessId(1024);
        event.setImage("C:\\Program Files\\app\\app.exe");
        event.setProtocol("tcp");
        event.setSourceHostname("10.50.86.136");
        event.setSourcePort(49712);
        event.setDestinationHostname(destinationHost);
        event.setDestinationPort(443);
    }

    public static Map<String, Object> processCreateRecord() {
        Map<String, Object> record = header(1);
        record.put("ProcessId", 3912);
        record.put("ParentProcessId", 2040);
        record.put("Image", "C:\\Windows\\System32\\cmd.exe");
        record.put("ParentImage", "C:\\Windows\\explorer.exe");
        record.put("CommandLine", "cmd.exe /c whoami");
        record.put("User", "DESKTOP-7GQ2K1\\admin");
        return record;
    }

    public static Map<String, Object> fileCreateRecord() {
        Map<String, Object> record = header(11);
        record.put("ProcessId", 3912);
        record.put("Image", "C:\\Windows\\System32\\cmd.exe");
        record.put("TargetFilename", "C:\\Users\\admin\\AppData\\Local\\Temp\\payload.dll");
        record.put("CreationUtcTime", UTC_TIME);
        return record;
    }

    public static Map<String, Object> networkRecord(boolean initiated, String destinationIp) {
        Map<String, Object> record = header(3);
        record.put("ProcessId", "1024");
        record.put("Image", "C:\\Program Files\\app\\app.exe");
        record.put("Protocol", "tcp");
        record.put("Initiated", initiated);
        record.put("SourceIp", "10.50.86.136");
        record.put("SourceHostname", "");
        record.put("SourcePort", 49712);
        record.put("DestinationIp", destinationIp);
        record.put("DestinationPort", "443");
        return record;
    }

    private static Map<String, Object> header(int eventId) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("EventID", eventId);
        record.put("Computer", COMPUTER);
        record.put("UtcTime", UTC_TIME);
        return record;
    }

    public static String toJson(Map<String, Object> record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static GeneratedSubgraphs emptyBatch() {
        return new GeneratedSubgraphs(Collections.emptyList());
    }

    /**
     * 片段中指定类型的节点，按插入顺序
     */
    public static <T extends GraphNode> List<T> nodesOfType(GraphFragment fragment, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (GraphNode node : fragment.getNodes().values()) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }
}

package com.security.subgraph.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.subgraph.constants.SubgraphConstants.SysmonEventId;
import com.security.subgraph.exception.DecodeException;
import com.security.subgraph.model.event.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Sysmon JSON 行解析器
 *
 * 每行一个 JSON 对象，字段名与 Sysmon 事件字段一致，例如：
 * <pre>
 * {"EventID":1,"Computer":"DESKTOP-01","UtcTime":"2017-04-28 22:08:22.025",
 *  "ProcessId":3912,"ParentProcessId":2040,"Image":"C:\\Windows\\System32\\cmd.exe"}
 * </pre>
 * 网络事件（EventID 3）按 Initiated 区分方向：true 为出站，false 为入站。
 */
@Component
public class JsonTelemetryEventDecoder implements TelemetryEventDecoder {

    private final ObjectMapper objectMapper;

    public JsonTelemetryEventDecoder() {
        this(new ObjectMapper());
    }

    @Autowired
    public JsonTelemetryEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TelemetryEvent decode(String record) throws DecodeException {
        if (record == null || record.trim().isEmpty()) {
            throw new DecodeException("空记录");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(record);
        } catch (JsonProcessingException e) {
            throw new DecodeException("JSON解析失败: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("记录不是JSON对象");
        }

        int eventId = requiredInt(root, "EventID");
        switch (eventId) {
            case SysmonEventId.PROCESS_CREATE:
                return decodeProcessCreate(root);
            case SysmonEventId.FILE_CREATE:
                return decodeFileCreate(root);
            case SysmonEventId.NETWORK_CONNECT:
                return decodeNetwork(root);
            default:
                throw new DecodeException("不支持的EventID: " + eventId);
        }
    }

    private ProcessCreateEvent decodeProcessCreate(JsonNode root) throws DecodeException {
        ProcessCreateEvent event = new ProcessCreateEvent();
        fillHeader(event, root);
        event.setProcessId(requiredLong(root, "ProcessId"));
        event.setParentProcessId(requiredLong(root, "ParentProcessId"));
        event.setImage(text(root, "Image"));
        event.setProcessGuid(text(root, "ProcessGuid"));
        event.setCommandLine(text(root, "CommandLine"));
        event.setParentImage(text(root, "ParentImage"));
        event.setUser(text(root, "User"));
        return event;
    }

    private FileCreateEvent decodeFileCreate(JsonNode root) throws DecodeException {
        FileCreateEvent event = new FileCreateEvent();
        fillHeader(event, root);
        event.setProcessId(requiredLong(root, "ProcessId"));
        event.setImage(text(root, "Image"));
        event.setTargetFilename(text(root, "TargetFilename"));
        event.setCreationUtcTime(text(root, "CreationUtcTime"));
        return event;
    }

    private NetworkEvent decodeNetwork(JsonNode root) throws DecodeException {
        NetworkEvent event = isInitiated(root) ? new OutboundNetworkEvent() : new InboundNetworkEvent();
        fillHeader(event, root);
        event.setProcessId(requiredLong(root, "ProcessId"));
        event.setImage(text(root, "Image"));
        event.setProtocol(text(root, "Protocol"));
        event.setSourceHostname(hostOrIp(root, "SourceHostname", "SourceIp"));
        event.setSourcePort(requiredInt(root, "SourcePort"));
        event.setDestinationHostname(hostOrIp(root, "DestinationHostname", "DestinationIp"));
        event.setDestinationPort(requiredInt(root, "DestinationPort"));
        return event;
    }

    private void fillHeader(TelemetryEvent event, JsonNode root) {
        event.setComputer(text(root, "Computer"));
        event.setUtcTime(text(root, "UtcTime"));
    }

    private boolean isInitiated(JsonNode root) throws DecodeException {
        JsonNode node = root.get("Initiated");
        if (node == null || node.isNull()) {
            throw new DecodeException("缺少字段: Initiated");
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String value = node.asText().trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new DecodeException("Initiated 字段无效: " + value);
    }

    /**
     * 主机名为空时使用IP
     */
    private static String hostOrIp(JsonNode root, String hostField, String ipField) {
        String host = text(root, hostField);
        if (host != null && !host.trim().isEmpty() && !"-".equals(host.trim())) {
            return host;
        }
        return text(root, ipField);
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    /**
     * int 字段，超出范围时拒绝，不做截断
     */
    private static int requiredInt(JsonNode root, String field) throws DecodeException {
        long value = requiredLong(root, field);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new DecodeException("字段 " + field + " 超出范围: " + value, e);
        }
    }

    /**
     * 数字字段，兼容数字和数字字符串两种写法
     */
    private static long requiredLong(JsonNode root, String field) throws DecodeException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new DecodeException("缺少字段: " + field);
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new DecodeException("字段 " + field + " 不是数字: " + node.textValue(), e);
            }
        }
        throw new DecodeException("字段 " + field + " 类型错误: " + node.getNodeType());
    }
}

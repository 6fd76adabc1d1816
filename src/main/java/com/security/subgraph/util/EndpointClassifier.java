package com.security.subgraph.util;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * 内外网端点判断
 *
 * 只做字面文本匹配，不做 DNS 解析：非 IP 字面量的主机名一律视为外部。
 * 内部范围：
 * - IPv4: 127.0.0.0/8, 10.0.0.0/8, 172.16.0.0/12, 192.168.0.0/16
 * - IPv6: ::1, fc00::/7（首段 fcXX / fdXX）
 */
public final class EndpointClassifier {

    /**
     * 进程级共享，初始化后只读
     */
    private static final Pattern INTERNAL_IP = Pattern.compile(
            "127\\.|10\\.|172\\.(?:1[6-9]|2[0-9]|3[01])\\.|192\\.168\\.|::1$|[fF][cCdD][0-9a-fA-F]{2}:");

    private EndpointClassifier() {
    }

    /**
     * @param host 主机名或IP的原始字节
     * @return 是否内部地址
     */
    public static boolean isInternal(byte[] host) {
        if (host == null || host.length == 0) {
            return false;
        }
        // 单字节映射，任意字节都能转换
        return isInternal(new String(host, StandardCharsets.ISO_8859_1));
    }

    public static boolean isInternal(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }
        return INTERNAL_IP.matcher(host).lookingAt();
    }
}

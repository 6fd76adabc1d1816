package com.security.subgraph.util;

import com.security.subgraph.model.graph.NodeType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 节点 key 生成
 *
 * key = MD5(节点类型 + 各标识字段)，字段以 "长度:值" 形式拼接，
 * 相同的（类型, 字段）总是得到相同的 key，不依赖时间或随机数。
 */
public final class NodeKeys {

    private NodeKeys() {
    }

    public static String of(NodeType nodeType, String... parts) {
        return md5Hex(canonical(nodeType, parts));
    }

    static String canonical(NodeType nodeType, String... parts) {
        StringBuilder sb = new StringBuilder(nodeType.name());
        for (String part : parts) {
            String value = part == null ? "" : part;
            sb.append('|').append(value.length()).append(':').append(value);
        }
        return sb.toString();
    }

    private static String md5Hex(String str) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // 所有 JRE 都必须提供 MD5
            throw new IllegalStateException("MD5 不可用", e);
        }
        return bytesToHex(md.digest(str.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * 字节数组转十六进制字符串
     */
    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

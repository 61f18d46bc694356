package org.muma.minikv.protocol;

import java.nio.charset.StandardCharsets;

// 4. 批量字符串 ($) - 支持 null (表示 $-1)
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public boolean isNull() {
        return content == null;
    }
}

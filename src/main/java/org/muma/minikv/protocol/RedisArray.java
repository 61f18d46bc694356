package org.muma.minikv.protocol;

import java.util.List;

// 5. 数组 (*) - elements 为 null 时表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    /**
     * 把一组字面字符串包装成 BulkString 数组，命令和 KEYS 回复都用这个形式
     */
    public static RedisArray ofStrings(String... items) {
        RedisMessage[] elements = new RedisMessage[items.length];
        for (int i = 0; i < items.length; i++) {
            elements[i] = new BulkString(items[i]);
        }
        return new RedisArray(elements);
    }

    public static RedisArray ofStrings(List<String> items) {
        return ofStrings(items.toArray(new String[0]));
    }
}

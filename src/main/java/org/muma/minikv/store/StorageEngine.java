package org.muma.minikv.store;

import org.muma.minikv.common.RedisData;

import java.util.List;
import java.util.Map;

/**
 * 键空间。所有实现都必须保证每个操作是串行的 (一把全局锁)，
 * 过期只做惰性删除：读到或遍历到时才真正移除。
 */
public interface StorageEngine {

    // 写入，清除之前的过期时间
    void set(String key, String value);

    void setWithExpiry(String key, String value, long ttlMillis);

    /**
     * @return 值；不存在或已过期返回 null (已过期的顺便删除)
     */
    String get(String key);

    /**
     * 返回所有未过期的 Key，遍历过程中删除过期项。结果无序，排序由调用方负责。
     * 不做模式匹配，pattern 被忽略，总是返回全部存活的 Key。
     */
    List<String> keys(String pattern);

    // 从 RDB 快照批量灌入
    void load(Map<String, RedisData> entries);

    // 当前未过期数据的拷贝 (PSYNC 生成快照用)
    Map<String, RedisData> snapshot();

    int size();
}

package org.muma.minikv.common;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 键空间里的一条值记录
 */
@Getter
@ToString
@EqualsAndHashCode
public class RedisData {

    public static final long NO_EXPIRE = -1;

    private final String payload;

    // 绝对过期时间戳 (毫秒)，-1 表示不过期
    private final long expireAt;

    public RedisData(String payload) {
        this(payload, NO_EXPIRE);
    }

    public RedisData(String payload, long expireAt) {
        this.payload = payload;
        this.expireAt = expireAt;
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRE && expireAt < now;
    }
}

package org.muma.minikv.protocol;

/**
 * PSYNC 的回复：+FULLRESYNC 行紧跟 RDB 快照，编码时作为一个整体写出，
 * 保证中间不会插入其他传播命令。
 */
public record FullResync(String replId, long offset, byte[] rdb) implements RedisMessage {

    public String header() {
        return "FULLRESYNC " + replId + " " + offset;
    }
}

package org.muma.minikv.protocol;

/**
 * 全量同步时传输的 RDB 快照。
 * 线上格式和 BulkString 一样以 $len\r\n 开头，但末尾没有 CRLF。
 */
public record RdbTransfer(byte[] content) implements RedisMessage {
}

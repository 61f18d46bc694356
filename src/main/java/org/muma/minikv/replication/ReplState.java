package org.muma.minikv.replication;

/**
 * 从节点自身的复制状态机
 */
public enum ReplState {
    NONE,               // 非 Slave (Master 模式)，或握手失败
    CONNECTING,         // TCP 连接中
    RECEIVE_PONG,       // 已发 PING，等待 +PONG
    RECEIVE_PORT_OK,    // 已发 REPLCONF listening-port，等待 +OK
    RECEIVE_CAPA_OK,    // 已发 REPLCONF capa，等待 +OK
    RECEIVE_PSYNC,      // 已发 PSYNC，等待 +FULLRESYNC
    TRANSFER,           // 正在接收 RDB
    CONNECTED           // 全量同步完成，进入命令流
}

package org.muma.minikv.protocol;

// 密封接口，限制实现类
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray, RdbTransfer, FullResync {
}

package org.muma.minikv.command;

import java.util.List;

/**
 * 已解析的命令。封闭的变体集合，每种命令一个 record，无法识别的落到 {@link Unknown}。
 */
public sealed interface Command {

    record Ping(String message) implements Command {
    }

    record Echo(String message) implements Command {
    }

    record Set(String key, String value, long ttlMillis) implements Command {

        public static final long NO_TTL = -1;

        public Set(String key, String value) {
            this(key, value, NO_TTL);
        }

        public boolean hasTtl() {
            return ttlMillis != NO_TTL;
        }

        /**
         * 标准形式，本地执行和向从节点传播用的是同一份
         */
        public String[] toCommandArgs() {
            return hasTtl()
                    ? new String[]{"SET", key, value, "PX", String.valueOf(ttlMillis)}
                    : new String[]{"SET", key, value};
        }
    }

    record Get(String key) implements Command {
    }

    record Keys(String pattern) implements Command {
    }

    record ConfigGet(String parameter) implements Command {
    }

    record Info(String section) implements Command {
    }

    record ReplConfListeningPort(int port) implements Command {
    }

    record ReplConfCapa(List<String> capabilities) implements Command {
    }

    record ReplConfGetAck() implements Command {
    }

    record ReplConfAck(long offset) implements Command {
    }

    record Psync(String replId, long offset) implements Command {
    }

    record Wait(int numReplicas, long timeoutMillis) implements Command {
    }

    record Unknown(String name) implements Command {
    }
}

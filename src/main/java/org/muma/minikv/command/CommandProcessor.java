package org.muma.minikv.command;

import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.CommandFrame;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.FullResync;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisInteger;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.RespCodec;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.rdb.RdbSaver;
import org.muma.minikv.replication.ReplicaHandle;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.ReplicationMetadata;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 命令执行器
 * 解析命令帧，对键空间和复制管理器执行对应操作，生成回复。
 * 所有命令级错误都在这里转换成 -ERR 回复，不会继续往外抛。
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final StorageEngine storage;
    private final ReplicationManager replicationManager;
    private final ReplicationMetadata metadata;
    private final MiniKvConfig config;
    private final CommandParser parser = new CommandParser();
    private final RdbSaver rdbSaver = new RdbSaver();

    public CommandProcessor(StorageEngine storage, ReplicationManager replicationManager,
                            ReplicationMetadata metadata, MiniKvConfig config) {
        this.storage = storage;
        this.replicationManager = replicationManager;
        this.metadata = metadata;
        this.config = config;
    }

    /**
     * 核心分发逻辑
     *
     * @return 要写回的回复；null 表示不回复
     */
    public RedisMessage process(CommandFrame frame, RedisContext context) {
        String commandName = frame.name().toUpperCase(Locale.ROOT);
        long startTime = System.nanoTime();

        Command command = null;
        RedisMessage response;
        try {
            command = parser.parse(frame.args());
            response = execute(command, context);
        } catch (IllegalArgumentException e) {
            // 预期内的业务错误 (参数个数、格式不对)
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            response = new ErrorMessage("ERR " + e.getMessage());
        } catch (Exception e) {
            log.error("Internal Server Error processing command: {}", commandName, e);
            response = new ErrorMessage("ERR internal server error");
        }

        long duration = (System.nanoTime() - startTime) / 1000_000;
        if (duration > SLOW_COMMAND_MILLIS) {
            log.warn("Slow command detected: {} cost {}ms", commandName, duration);
        } else if (log.isDebugEnabled()) {
            log.debug("Command executed: {} args={} cost {}ms", commandName, frame.args().size() - 1, duration);
        }

        if (context.isMasterLink() && !(command instanceof Command.ReplConfGetAck)) {
            // Master 传播过来的命令只执行不回复
            if (response instanceof ErrorMessage err) {
                log.warn("Replicated command {} failed: {}", commandName, err.content());
            }
            return null;
        }
        return response;
    }

    public RedisMessage execute(Command command, RedisContext context) {
        if (command instanceof Command.Ping ping) {
            return ping.message() == null ? SimpleString.PONG : new BulkString(ping.message());
        } else if (command instanceof Command.Echo echo) {
            return new BulkString(echo.message());
        } else if (command instanceof Command.Set set) {
            return handleSet(set);
        } else if (command instanceof Command.Get get) {
            String value = storage.get(get.key());
            return value == null ? BulkString.NULL : new BulkString(value);
        } else if (command instanceof Command.Keys keys) {
            List<String> result = new ArrayList<>(storage.keys(keys.pattern()));
            result.sort(null);
            return RedisArray.ofStrings(result);
        } else if (command instanceof Command.ConfigGet configGet) {
            String value = config.get(configGet.parameter());
            return value == null ? BulkString.NULL : RedisArray.ofStrings(configGet.parameter(), value);
        } else if (command instanceof Command.Info info) {
            return handleInfo(info);
        } else if (command instanceof Command.ReplConfListeningPort listeningPort) {
            return handleListeningPort(listeningPort, context);
        } else if (command instanceof Command.ReplConfCapa capa) {
            log.debug("Replica {} capabilities: {}", context.describe(), capa.capabilities());
            return SimpleString.OK;
        } else if (command instanceof Command.ReplConfGetAck) {
            return RedisArray.ofStrings("REPLCONF", "ACK", String.valueOf(context.getProcessedBytes()));
        } else if (command instanceof Command.ReplConfAck ack) {
            log.debug("Replica {} acknowledged offset {}", context.describe(), ack.offset());
            return null;
        } else if (command instanceof Command.Psync psync) {
            return handlePsync(psync, context);
        } else if (command instanceof Command.Wait wait) {
            int acked = replicationManager.waitFor(wait.numReplicas());
            return new RedisInteger(acked >= 0 ? acked : replicationManager.replicaCount());
        } else {
            return new ErrorMessage("ERR unknown command");
        }
    }

    private RedisMessage handleSet(Command.Set set) {
        // 先传播，再本地执行，两边用同一份标准编码
        replicationManager.propagate(RespCodec.encodeCommand(set.toCommandArgs()));

        if (set.hasTtl()) {
            storage.setWithExpiry(set.key(), set.value(), set.ttlMillis());
        } else {
            storage.set(set.key(), set.value());
        }
        return SimpleString.OK;
    }

    private RedisMessage handleInfo(Command.Info info) {
        String section = info.section() == null ? "replication" : info.section().toLowerCase(Locale.ROOT);
        if (!"replication".equals(section) && !"all".equals(section) && !"default".equals(section)) {
            // 不认识的 section 和 Redis 一样返回空内容
            return new BulkString("");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("# Replication\r\n");
        if (metadata.isSlave()) {
            sb.append("role:slave\r\n");
            sb.append("master_host:").append(metadata.getMasterHost()).append("\r\n");
            sb.append("master_port:").append(metadata.getMasterPort()).append("\r\n");
        } else {
            sb.append("role:master\r\n");
        }
        sb.append("connected_slaves:").append(replicationManager.replicaCount()).append("\r\n");
        sb.append("master_replid:").append(metadata.getMyReplId()).append("\r\n");
        sb.append("master_repl_offset:").append(metadata.getReplOffset()).append("\r\n");
        return new BulkString(sb.toString());
    }

    private RedisMessage handleListeningPort(Command.ReplConfListeningPort listeningPort, RedisContext context) {
        ReplicaHandle handle = context.markReplica();
        if (handle != null) {
            log.info("Replica {} announced listening port {}", context.describe(), listeningPort.port());
            replicationManager.register(handle);
        }
        return SimpleString.OK;
    }

    private RedisMessage handlePsync(Command.Psync psync, RedisContext context) {
        // 不支持增量同步，全部 Full Resync
        byte[] rdb = rdbSaver.dump(storage.snapshot());
        log.info("Full resync requested by {} (replid={}, offset={}), sending {} bytes RDB",
                context.describe(), psync.replId(), psync.offset(), rdb.length);
        return new FullResync(metadata.getMyReplId(), metadata.getReplOffset(), rdb);
    }
}

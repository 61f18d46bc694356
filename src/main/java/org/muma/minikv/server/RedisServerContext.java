package org.muma.minikv.server;

import lombok.Getter;
import org.muma.minikv.command.CommandProcessor;
import org.muma.minikv.common.RedisData;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.rdb.RdbLoader;
import org.muma.minikv.replication.MasterLinkClient;
import org.muma.minikv.replication.RedisSlaveHandler;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.ReplicationMetadata;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Redis 服务器上下文
 * 负责组装各个模块，所有连接共享同一份实例。
 */
@Getter
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final ReplicationMetadata replicationMetadata;
    private final ReplicationManager replicationManager;
    private final CommandProcessor processor;
    private final RdbLoader rdbLoader;

    public RedisServerContext(MiniKvConfig config) {
        this.config = config;

        // 1. Storage
        this.storage = new MemoryStorageEngine();
        this.rdbLoader = new RdbLoader();

        // 2. Replication
        this.replicationMetadata = new ReplicationMetadata();
        if (config.isReplica()) {
            replicationMetadata.setMaster(config.getReplicaOfHost(), config.getReplicaOfPort());
        }
        this.replicationManager = new ReplicationManager();

        // 3. Processor
        this.processor = new CommandProcessor(storage, replicationManager, replicationMetadata, config);
    }

    /**
     * 启动前加载快照。快照不可用时只打日志，以空键空间启动。
     */
    public void init() {
        Optional<File> snapshot = config.getSnapshotFile();
        if (snapshot.isEmpty()) {
            log.info("No dir/dbfilename configured, skipping RDB load");
            return;
        }
        try {
            Map<String, RedisData> entries = rdbLoader.load(snapshot.get());
            storage.load(entries);
        } catch (IOException e) {
            log.warn("Failed to load RDB {}, starting with an empty keyspace: {}",
                    snapshot.get().getPath(), e.getMessage());
        }
    }

    /**
     * 从节点模式下连接 Master 用的客户端，主节点模式下为空
     */
    public Optional<MasterLinkClient> masterLink() {
        if (!config.isReplica()) {
            return Optional.empty();
        }
        return Optional.of(new MasterLinkClient(config.getReplicaOfHost(), config.getReplicaOfPort(),
                this::newSlaveHandler));
    }

    public RedisSlaveHandler newSlaveHandler() {
        return new RedisSlaveHandler(config.getPort(), replicationMetadata, storage, processor, rdbLoader);
    }
}

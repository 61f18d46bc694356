package org.muma.minikv.replication;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 复制管理器 (Master 角色)
 * 维护已注册的从节点列表和一个待确认计数，所有方法串行执行。
 * <p>
 * 待确认计数只是个启发值：每次传播时每成功发送一次加一，传播结束后无条件清零，
 * 所以 WAIT 最多只能看到最近一次传播贡献的计数，并不是真正的 ACK 协议。
 */
public class ReplicationManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicationManager.class);

    // 按注册顺序
    private final List<ReplicaHandle> replicas = new ArrayList<>();

    private int pendingAcks = 0;

    public synchronized void register(ReplicaHandle handle) {
        replicas.add(handle);
        log.info("Replica registered: {}, total replicas: {}", handle.describe(), replicas.size());
    }

    /**
     * 命令传播 (Propagate)：尽力发给每个从节点，不等待确认
     *
     * @return 本次传播中计数达到的峰值 (成功发送的从节点数)
     */
    public synchronized int propagate(byte[] command) {
        int peak = 0;
        Iterator<ReplicaHandle> iterator = replicas.iterator();
        while (iterator.hasNext()) {
            ReplicaHandle replica = iterator.next();
            if (!replica.isActive()) {
                iterator.remove(); // 懒惰清理
                log.info("Replica {} disconnected, removed. Remaining: {}", replica.describe(), replicas.size());
                continue;
            }
            if (replica.send(command)) {
                pendingAcks++;
                peak = pendingAcks;
            } else {
                log.warn("Failed to propagate command to replica {}", replica.describe());
            }
        }
        pendingAcks = 0;
        return peak;
    }

    /**
     * 计数满足要求时清零，返回清零前的计数；否则立即返回 -1，不阻塞也不重试
     */
    public synchronized int waitFor(int count) {
        if (pendingAcks >= count) {
            int acked = pendingAcks;
            pendingAcks = 0;
            return acked;
        }
        return -1;
    }

    public synchronized int pendingAcks() {
        return pendingAcks;
    }

    public synchronized int replicaCount() {
        return replicas.size();
    }
}

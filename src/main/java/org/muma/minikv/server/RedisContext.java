package org.muma.minikv.server;

import io.netty.channel.Channel;
import org.muma.minikv.replication.ChannelReplicaHandle;
import org.muma.minikv.replication.ReplicaHandle;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的所有环境信息
 */
public class RedisContext {

    private final Channel channel;

    // 是否是从节点连向 Master 的链路：该链路上的命令只执行不回复 (GETACK 除外)
    private final boolean masterLink;

    // 本连接上已经处理完的命令字节数 (REPLCONF GETACK 回报的偏移量)
    private long processedBytes;

    private boolean replicaRegistered;

    public RedisContext(Channel channel) {
        this(channel, false);
    }

    public RedisContext(Channel channel, boolean masterLink) {
        this.channel = channel;
        this.masterLink = masterLink;
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isMasterLink() {
        return masterLink;
    }

    public long getProcessedBytes() {
        return processedBytes;
    }

    public void addProcessedBytes(long bytes) {
        processedBytes += bytes;
    }

    public boolean isReplicaRegistered() {
        return replicaRegistered;
    }

    /**
     * 把当前连接登记为从节点输出通道，每个连接只登记一次
     *
     * @return 新建的通道；已经登记过则返回 null
     */
    public ReplicaHandle markReplica() {
        if (replicaRegistered) {
            return null;
        }
        replicaRegistered = true;
        return new ChannelReplicaHandle(channel);
    }

    public String describe() {
        return channel == null ? "<detached>" : String.valueOf(channel.remoteAddress());
    }
}

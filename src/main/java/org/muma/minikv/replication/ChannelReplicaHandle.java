package org.muma.minikv.replication;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;

/**
 * 基于 Netty Channel 的从节点通道
 * writeAndFlush 可以在任意线程调用，Netty 会把写操作排进该连接的 EventLoop，按提交顺序写出。
 */
public class ChannelReplicaHandle implements ReplicaHandle {

    private final Channel channel;

    public ChannelReplicaHandle(Channel channel) {
        this.channel = channel;
    }

    @Override
    public boolean send(byte[] command) {
        if (!channel.isActive()) {
            return false;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(command));
        return true;
    }

    @Override
    public boolean isActive() {
        return channel.isActive();
    }

    @Override
    public String describe() {
        return String.valueOf(channel.remoteAddress());
    }
}

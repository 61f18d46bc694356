package org.muma.minikv.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.muma.minikv.protocol.RespEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 从节点启动时连接 Master，握手由 {@link RedisSlaveHandler} 驱动。
 * 连接失败只记录日志，不重试，也不影响本节点继续对外服务。
 */
public class MasterLinkClient {

    private static final Logger log = LoggerFactory.getLogger(MasterLinkClient.class);

    private final String masterHost;
    private final int masterPort;
    private final Supplier<RedisSlaveHandler> handlerFactory;

    public MasterLinkClient(String masterHost, int masterPort, Supplier<RedisSlaveHandler> handlerFactory) {
        this.masterHost = masterHost;
        this.masterPort = masterPort;
        this.handlerFactory = handlerFactory;
    }

    public ChannelFuture connect(EventLoopGroup group) {
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new MasterStreamDecoder())
                                .addLast(new RespEncoder())
                                .addLast(handlerFactory.get());
                    }
                });

        log.info("Connecting to master {}:{}", masterHost, masterPort);
        return b.connect(masterHost, masterPort)
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.error("Failed to connect to master {}:{}, replication disabled: {}",
                                masterHost, masterPort, future.cause().getMessage());
                    }
                });
    }
}

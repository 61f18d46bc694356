package org.muma.minikv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.RespDecoder;
import org.muma.minikv.protocol.RespEncoder;
import org.muma.minikv.server.RedisCommandHandler;
import org.muma.minikv.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final RedisServerContext context;

    public MiniKvServer(RedisServerContext context) {
        this.context = context;
    }

    public void start() throws InterruptedException {
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup();

        // 1. 加载快照 (必须在接受连接之前)
        context.init();

        int port = context.getConfig().getPort();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.INFO))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new RespDecoder())
                                    .addLast(new RespEncoder())
                                    .addLast(new RedisCommandHandler(context.getProcessor()));
                        }
                    });

            log.info("Starting Mini-KV server on port {}", port);
            ChannelFuture future = bootstrap.bind(port).sync();
            log.info("Mini-KV started successfully.");

            // 2. 从节点模式：监听之后再连 Master
            context.masterLink().ifPresent(link -> link.connect(workerGroup));

            future.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        MiniKvConfig config;
        try {
            config = MiniKvConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        new MiniKvServer(new RedisServerContext(config)).start();
    }
}

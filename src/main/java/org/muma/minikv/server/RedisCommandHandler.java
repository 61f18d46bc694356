package org.muma.minikv.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.minikv.command.CommandProcessor;
import org.muma.minikv.protocol.CommandFrame;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 客户端连接的 Handler：每读到一个命令帧就交给 CommandProcessor 执行并写回结果。
 * 复制传播由 ReplicationManager 直接写 Channel，与读取-执行循环互不干扰。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandProcessor processor;
    private RedisContext context;

    public RedisCommandHandler(CommandProcessor processor) {
        this.processor = processor;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        context = new RedisContext(ctx.channel());
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof ErrorMessage error) {
            // 解码器发现的协议错误
            ctx.writeAndFlush(error);
            return;
        }
        if (!(msg instanceof CommandFrame frame)) {
            log.warn("Received unexpected message: {}", msg);
            return;
        }
        if (frame.args().isEmpty()) {
            return;
        }

        RedisMessage response = processor.process(frame, context);
        context.addProcessedBytes(frame.wireLength());
        if (response != null) {
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Connection {} closed on error: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}

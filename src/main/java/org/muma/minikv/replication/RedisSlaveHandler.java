package org.muma.minikv.replication;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.minikv.command.CommandProcessor;
import org.muma.minikv.common.RedisData;
import org.muma.minikv.protocol.CommandFrame;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RdbTransfer;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.rdb.RdbLoadException;
import org.muma.minikv.rdb.RdbLoader;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Slave 端的 Netty Handler
 * 负责向 Master 发起握手、接收 RDB 快照，然后执行 Master 传播过来的写命令。
 * <p>
 * 握手任何一步收到意外回复都只会断开这条链路，本节点继续作为普通服务端提供服务。
 */
public class RedisSlaveHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(RedisSlaveHandler.class);

    private final int listeningPort;
    private final ReplicationMetadata metadata;
    private final StorageEngine storage;
    private final CommandProcessor processor;
    private final RdbLoader rdbLoader;

    private volatile ReplState state = ReplState.CONNECTING;
    private RedisContext context;

    public RedisSlaveHandler(int listeningPort, ReplicationMetadata metadata, StorageEngine storage,
                             CommandProcessor processor, RdbLoader rdbLoader) {
        this.listeningPort = listeningPort;
        this.metadata = metadata;
        this.storage = storage;
        this.processor = processor;
        this.rdbLoader = rdbLoader;
    }

    public ReplState getState() {
        return state;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        context = new RedisContext(ctx.channel(), true);
        log.info("Connected to master {}, starting handshake", ctx.channel().remoteAddress());
        sendPing(ctx);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (state != ReplState.NONE) {
            log.warn("Lost connection to master in state {}", state);
        }
        state = ReplState.NONE;
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        // 错误处理
        if (msg instanceof ErrorMessage err) {
            fail(ctx, "master responded error: " + err.content());
            return;
        }

        switch (state) {
            case RECEIVE_PONG -> {
                if (!isReply(msg, "PONG")) {
                    fail(ctx, "expected +PONG, got " + msg);
                    return;
                }
                log.info("Master PONG received.");
                sendReplConfPort(ctx);
            }
            case RECEIVE_PORT_OK -> {
                if (!isReply(msg, "OK")) {
                    fail(ctx, "expected +OK for listening-port, got " + msg);
                    return;
                }
                sendReplConfCapa(ctx);
            }
            case RECEIVE_CAPA_OK -> {
                if (!isReply(msg, "OK")) {
                    fail(ctx, "expected +OK for capa, got " + msg);
                    return;
                }
                sendPsync(ctx);
            }
            case RECEIVE_PSYNC -> handleFullResync(ctx, msg);
            case TRANSFER -> handleSnapshot(ctx, msg);
            case CONNECTED -> handlePropagatedCommand(ctx, msg);
            default -> log.warn("Ignoring message from master in state {}: {}", state, msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(ctx, cause.getMessage());
    }

    // --- State Actions ---

    private void sendPing(ChannelHandlerContext ctx) {
        state = ReplState.RECEIVE_PONG;
        ctx.writeAndFlush(RedisArray.ofStrings("PING"));
    }

    private void sendReplConfPort(ChannelHandlerContext ctx) {
        state = ReplState.RECEIVE_PORT_OK;
        ctx.writeAndFlush(RedisArray.ofStrings("REPLCONF", "listening-port", String.valueOf(listeningPort)));
    }

    private void sendReplConfCapa(ChannelHandlerContext ctx) {
        state = ReplState.RECEIVE_CAPA_OK;
        ctx.writeAndFlush(RedisArray.ofStrings("REPLCONF", "capa", "psync2"));
    }

    private void sendPsync(ChannelHandlerContext ctx) {
        state = ReplState.RECEIVE_PSYNC;
        ctx.writeAndFlush(RedisArray.ofStrings("PSYNC", "?", "-1"));
    }

    // --- Callbacks ---

    private void handleFullResync(ChannelHandlerContext ctx, Object msg) {
        // +FULLRESYNC <replid> <offset>
        String[] parts = msg instanceof SimpleString ss ? ss.content().split(" ") : new String[0];
        if (parts.length != 3 || !"FULLRESYNC".equals(parts[0])) {
            fail(ctx, "expected +FULLRESYNC, got " + msg);
            return;
        }
        long offset;
        try {
            offset = Long.parseLong(parts[2]);
        } catch (NumberFormatException e) {
            fail(ctx, "invalid FULLRESYNC offset " + parts[2]);
            return;
        }
        metadata.setMasterReplId(parts[1]);
        metadata.setMasterOffset(offset);
        state = ReplState.TRANSFER;
        log.info("Full resync triggered. Master ReplID: {}, Offset: {}", parts[1], offset);
    }

    private void handleSnapshot(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof RdbTransfer rdb)) {
            fail(ctx, "expected RDB payload, got " + msg);
            return;
        }
        try {
            Map<String, RedisData> entries = rdbLoader.parse(rdb.content());
            storage.load(entries);
            log.info("RDB received from master: {} bytes, {} keys", rdb.content().length, entries.size());
        } catch (RdbLoadException e) {
            // 快照损坏不影响后续命令流，键空间保持为空
            log.warn("Failed to load RDB from master, keyspace left empty: {}", e.getMessage());
        }
        state = ReplState.CONNECTED;
        log.info("Replication link established, streaming commands from master");
    }

    private void handlePropagatedCommand(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof CommandFrame frame) || frame.args().isEmpty()) {
            log.warn("Ignoring unexpected message from master: {}", msg);
            return;
        }
        RedisMessage response = processor.process(frame, context);
        context.addProcessedBytes(frame.wireLength());
        if (response != null) {
            ctx.writeAndFlush(response);
        }
    }

    private void fail(ChannelHandlerContext ctx, String reason) {
        log.error("Replication with master failed in state {}: {}", state, reason);
        state = ReplState.NONE;
        ctx.close();
    }

    private static boolean isReply(Object msg, String expected) {
        return msg instanceof SimpleString ss && expected.equalsIgnoreCase(ss.content());
    }
}

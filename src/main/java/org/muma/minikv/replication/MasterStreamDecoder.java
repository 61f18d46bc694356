package org.muma.minikv.replication;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import org.muma.minikv.protocol.Decoded;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RdbTransfer;
import org.muma.minikv.protocol.RespCodec;
import org.muma.minikv.protocol.RespProtocolException;
import org.muma.minikv.protocol.SimpleString;

import java.util.List;

/**
 * 从节点连向 Master 的链路解码器，按阶段切换帧格式：
 * <ol>
 *     <li>HANDSHAKE: 握手回复，+xxx 或 -ERR xxx；收到 +FULLRESYNC 后进入 SNAPSHOT</li>
 *     <li>SNAPSHOT: $len\r\n + RDB 字节 (没有结尾 CRLF)</li>
 *     <li>STREAM: Master 传播过来的命令数组</li>
 * </ol>
 * FULLRESYNC 行、RDB 和后续命令可能挤在同一个 TCP 包里，状态切换后 ReplayingDecoder 会继续解码剩余字节。
 */
public class MasterStreamDecoder extends ReplayingDecoder<MasterStreamDecoder.Phase> {

    public enum Phase {
        HANDSHAKE,
        SNAPSHOT,
        STREAM
    }

    public MasterStreamDecoder() {
        super(Phase.HANDSHAKE);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        switch (state()) {
            case HANDSHAKE -> {
                byte type = in.getByte(in.readerIndex());
                if (type == RespCodec.ERROR) {
                    out.add(new ErrorMessage(RespCodec.decodeError(in).value()));
                    checkpoint();
                    return;
                }
                if (type != RespCodec.SIMPLE_STRING) {
                    throw new RespProtocolException("unexpected reply type during handshake: " + (char) type);
                }
                String reply = RespCodec.decodeSimpleString(in).value();
                out.add(new SimpleString(reply));
                if (reply.startsWith("FULLRESYNC")) {
                    checkpoint(Phase.SNAPSHOT);
                } else {
                    checkpoint();
                }
            }
            case SNAPSHOT -> {
                Decoded<byte[]> rdb = RespCodec.decodeRdbPayload(in);
                out.add(new RdbTransfer(rdb.value()));
                checkpoint(Phase.STREAM);
            }
            case STREAM -> {
                out.add(RespCodec.decodeCommand(in));
                checkpoint();
            }
        }
    }
}

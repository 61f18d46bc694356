package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 客户端连接上的 RESP 解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时回滚到 checkpoint，等下次数据到达再重放。
 * <p>
 * 输出 {@link CommandFrame}；帧格式错误时丢弃已缓冲的数据并输出一个 {@link ErrorMessage}，
 * 由后面的 Handler 原样回给客户端，连接保持打开。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            out.add(RespCodec.decodeCommand(in));
        } catch (RespProtocolException e) {
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            // 出错位置之后的字节已经无法对齐帧边界，整体丢弃
            in.skipBytes(actualReadableBytes());
            out.add(new ErrorMessage("ERR Protocol error: " + e.getMessage()));
        }
    }
}

package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * RESP 编码器。复制传播写入的是已经编码好的 ByteBuf，不经过这里，直接透传。
 */
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        RespCodec.write(out, msg);
    }
}

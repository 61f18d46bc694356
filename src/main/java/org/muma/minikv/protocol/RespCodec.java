package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议编解码工具类
 * <p>
 * 解码方法只用 readByte / readBytes 读取数据，因此既能直接作用于普通 ByteBuf，
 * 也能在 ReplayingDecoder 中使用 (数据不够时由 Netty 回滚到 checkpoint 重放)。
 * 每个解码方法都返回消耗的字节数。
 */
public final class RespCodec {

    public static final byte SIMPLE_STRING = '+';
    public static final byte ERROR = '-';
    public static final byte INTEGER = ':';
    public static final byte BULK_STRING = '$';
    public static final byte ARRAY = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    // 与 Redis 的 proto-max-bulk-len 一致
    public static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final long MAX_ARRAY_LENGTH = 1024L * 1024;

    private RespCodec() {
    }

    // =========================================================
    // Decode
    // =========================================================

    /**
     * 读取 CRLF 结尾的十进制无符号整数
     */
    public static Decoded<Long> decodeLength(ByteBuf in) {
        long value = 0;
        int digits = 0;
        int consumed = 0;
        while (true) {
            byte b = in.readByte();
            consumed++;
            if (b == CR) {
                break;
            }
            if (b < '0' || b > '9') {
                throw new RespProtocolException("invalid length byte '" + printable(b) + "'");
            }
            value = value * 10 + (b - '0');
            if (value > MAX_BULK_LENGTH) {
                throw new RespProtocolException("length out of range");
            }
            digits++;
        }
        expect(in, LF);
        consumed++;
        if (digits == 0) {
            throw new RespProtocolException("empty length");
        }
        return new Decoded<>(value, consumed);
    }

    /**
     * +content\r\n
     */
    public static Decoded<String> decodeSimpleString(ByteBuf in) {
        expect(in, SIMPLE_STRING);
        Decoded<String> line = readLine(in);
        return new Decoded<>(line.value(), line.consumed() + 1);
    }

    /**
     * -content\r\n
     */
    public static Decoded<String> decodeError(ByteBuf in) {
        expect(in, ERROR);
        Decoded<String> line = readLine(in);
        return new Decoded<>(line.value(), line.consumed() + 1);
    }

    /**
     * $len\r\ndata\r\n
     */
    public static Decoded<String> decodeBulkString(ByteBuf in) {
        expect(in, BULK_STRING);
        Decoded<Long> length = decodeLength(in);
        int len = length.value().intValue();
        // readSlice 在 ReplayingDecoder 中数据不够时直接回滚，不会先按 len 分配内存
        String content = in.readSlice(len).toString(StandardCharsets.UTF_8);
        expect(in, CR);
        expect(in, LF);
        return new Decoded<>(content, 1 + length.consumed() + len + 2);
    }

    /**
     * *count\r\n 后跟 count 个 Bulk String
     */
    public static Decoded<List<String>> decodeArray(ByteBuf in) {
        expect(in, ARRAY);
        Decoded<Long> count = decodeLength(in);
        if (count.value() > MAX_ARRAY_LENGTH) {
            throw new RespProtocolException("invalid multibulk length");
        }
        int consumed = 1 + count.consumed();
        List<String> elements = new ArrayList<>(count.value().intValue());
        for (long i = 0; i < count.value(); i++) {
            Decoded<String> element = decodeBulkString(in);
            elements.add(element.value());
            consumed += element.consumed();
        }
        return new Decoded<>(elements, consumed);
    }

    /**
     * 客户端请求的唯一入口：Bulk String 数组
     */
    public static CommandFrame decodeCommand(ByteBuf in) {
        Decoded<List<String>> array = decodeArray(in);
        return new CommandFrame(array.value(), array.consumed());
    }

    /**
     * 全量同步的 RDB 负载：$len\r\n 后跟 len 字节，没有结尾 CRLF
     */
    public static Decoded<byte[]> decodeRdbPayload(ByteBuf in) {
        expect(in, BULK_STRING);
        Decoded<Long> length = decodeLength(in);
        int len = length.value().intValue();
        byte[] content = ByteBufUtil.getBytes(in.readSlice(len));
        return new Decoded<>(content, 1 + length.consumed() + len);
    }

    private static Decoded<String> readLine(ByteBuf in) {
        StringBuilder sb = new StringBuilder();
        int consumed = 0;
        while (true) {
            byte b = in.readByte();
            consumed++;
            if (b == CR) {
                expect(in, LF);
                consumed++;
                return new Decoded<>(sb.toString(), consumed);
            }
            if (b == LF) {
                throw new RespProtocolException("unexpected LF in line");
            }
            sb.append((char) (b & 0xFF));
        }
    }

    private static void expect(ByteBuf in, byte expected) {
        byte b = in.readByte();
        if (b != expected) {
            throw new RespProtocolException("expected '" + printable(expected) + "', got '" + printable(b) + "'");
        }
    }

    private static String printable(byte b) {
        if (b == CR) return "\\r";
        if (b == LF) return "\\n";
        if (b >= 0x20 && b < 0x7F) return String.valueOf((char) b);
        return String.format("\\x%02x", b & 0xFF);
    }

    // =========================================================
    // Encode
    // =========================================================

    public static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            writeLine(out, SIMPLE_STRING, s.content());
        } else if (msg instanceof ErrorMessage e) {
            writeLine(out, ERROR, e.content());
        } else if (msg instanceof RedisInteger i) {
            writeLine(out, INTEGER, String.valueOf(i.value()));
        } else if (msg instanceof BulkString b) {
            if (b.content() == null) {
                writeLine(out, BULK_STRING, "-1");
            } else {
                writeLine(out, BULK_STRING, String.valueOf(b.content().length));
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            if (a.elements() == null) {
                writeLine(out, ARRAY, "-1");
            } else {
                writeLine(out, ARRAY, String.valueOf(a.elements().length));
                for (RedisMessage element : a.elements()) {
                    write(out, element);
                }
            }
        } else if (msg instanceof RdbTransfer r) {
            writeLine(out, BULK_STRING, String.valueOf(r.content().length));
            out.writeBytes(r.content());
        } else if (msg instanceof FullResync f) {
            writeLine(out, SIMPLE_STRING, f.header());
            write(out, new RdbTransfer(f.rdb()));
        }
    }

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            write(buf, msg);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 编码成标准的 Bulk String 数组命令，用于向从节点传播
     */
    public static byte[] encodeCommand(String... parts) {
        return encode(RedisArray.ofStrings(parts));
    }

    private static void writeLine(ByteBuf out, byte type, String content) {
        out.writeByte(type);
        out.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }
}

package org.muma.minikv.rdb;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * RDB 反序列化器
 * 负责从完整的快照字节中读取 RDB 的基础单元：字节、长度编码、字符串、小端时间戳。
 * <p>
 * 快照整体在内存里，剩余字节数是准确的：声明的长度超过剩余字节时直接判定为截断，不会按声明长度分配内存。
 */
public class RdbDecoder {

    private final ByteArrayInputStream source;
    private final DataInputStream in;

    public RdbDecoder(byte[] snapshot) {
        this.source = new ByteArrayInputStream(snapshot);
        // 使用 DataInputStream 方便读取 byte, int, long
        this.in = new DataInputStream(source);
    }

    /**
     * 读取一个字节 (0-255)
     */
    public int readByte() throws IOException {
        return in.readUnsignedByte();
    }

    /**
     * 读取指定长度的字节数组
     */
    public byte[] readBytes(int len) throws IOException {
        int remaining = source.available();
        if (len > remaining) {
            throw new RdbLoadException("Truncated RDB snapshot: " + len + " bytes declared, " + remaining + " left");
        }
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }

    /**
     * 读取 RDB 长度编码
     *
     * @return 解析出的长度值
     */
    public long readLength() throws IOException {
        int b = in.readUnsignedByte();
        int type = (b & 0xC0) >> 6;
        if (type == RdbConstants.LEN_ENCVAL) {
            throw new RdbLoadException("Unsupported RDB length encoding: 0x" + Integer.toHexString(b));
        }
        return readLength(b, type);
    }

    private long readLength(int b, int type) throws IOException {
        if (type == RdbConstants.LEN_6BIT) {
            // 00xxxxxx: 6位长度
            return b & 0x3F;
        } else if (type == RdbConstants.LEN_14BIT) {
            // 01xxxxxx xxxxxxxx: 14位长度
            int next = in.readUnsignedByte();
            return ((b & 0x3F) << 8) | next;
        } else {
            // 10xxxxxx: 忽略低6位，后接 4 字节大端
            return in.readInt() & 0xFFFFFFFFL;
        }
    }

    /**
     * 读取字符串对象 (Key / Value)，不接受特殊编码
     */
    public byte[] readString() throws IOException {
        long len = readLength();
        if (len > Integer.MAX_VALUE) {
            throw new RdbLoadException("String too long: " + len);
        }
        return readBytes((int) len);
    }

    public String readStringUtf8() throws IOException {
        return decodeUtf8(readString());
    }

    /**
     * 读取辅助字段里的字符串。
     * Redis 会把 redis-bits、ctime 这类数值写成整数编码 (11000000 ~ 11000010)，这里转回十进制文本。
     */
    public String readAuxString() throws IOException {
        int b = in.readUnsignedByte();
        int type = (b & 0xC0) >> 6;
        if (type != RdbConstants.LEN_ENCVAL) {
            long len = readLength(b, type);
            if (len > Integer.MAX_VALUE) {
                throw new RdbLoadException("String too long: " + len);
            }
            return decodeUtf8(readBytes((int) len));
        }
        return switch (b & 0x3F) {
            case RdbConstants.ENC_INT8 -> String.valueOf(in.readByte());
            case RdbConstants.ENC_INT16 -> String.valueOf(Short.reverseBytes(in.readShort()));
            case RdbConstants.ENC_INT32 -> String.valueOf(Integer.reverseBytes(in.readInt()));
            default -> throw new RdbLoadException("Unsupported RDB string encoding: 0x" + Integer.toHexString(b));
        };
    }

    /**
     * 8 字节小端时间戳 (毫秒)
     */
    public long readMillisTimestamp() throws IOException {
        return Long.reverseBytes(in.readLong());
    }

    /**
     * 4 字节小端时间戳 (秒)
     */
    public long readSecondsTimestamp() throws IOException {
        return Integer.toUnsignedLong(Integer.reverseBytes(in.readInt()));
    }

    private static String decodeUtf8(byte[] bytes) throws RdbLoadException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new RdbLoadException("Invalid UTF-8 string in RDB", e);
        }
    }
}

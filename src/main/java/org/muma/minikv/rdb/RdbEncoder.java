package org.muma.minikv.rdb;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * RDB 序列化器
 * 负责把基础单元写成 RDB 格式：长度编码、字符串、小端时间戳。
 */
public class RdbEncoder {

    private final OutputStream out;

    public RdbEncoder(OutputStream out) {
        this.out = out;
    }

    public void writeByte(int b) throws IOException {
        out.write(b);
    }

    /**
     * 写入字节数组 (原样写入，不带长度)
     */
    public void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
    }

    /**
     * 写入 RDB 长度编码 (Length Encoding)
     * <p>
     * 规则:
     * - 00xxxxxx: len < 64 (1 byte)
     * - 01xxxxxx: len < 16384 (2 bytes)
     * - 10000000: len >= 16384 (5 bytes, 1 byte flag + 4 bytes 大端)
     */
    public void writeLength(long len) throws IOException {
        if (len < 64) {
            out.write((int) (len & 0xFF));
        } else if (len < 16384) {
            out.write(0x40 | (int) ((len >> 8) & 0x3F));
            out.write((int) (len & 0xFF));
        } else {
            out.write(0x80);
            out.write((int) (len >>> 24) & 0xFF);
            out.write((int) (len >>> 16) & 0xFF);
            out.write((int) (len >>> 8) & 0xFF);
            out.write((int) len & 0xFF);
        }
    }

    /**
     * 写入字符串对象
     * 格式: [Length][Content]
     */
    public void writeString(String str) throws IOException {
        byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
        writeLength(bytes.length);
        writeBytes(bytes);
    }

    /**
     * 写入 8 字节小端毫秒时间戳
     */
    public void writeMillisTimestamp(long v) throws IOException {
        for (int i = 0; i < 8; i++) {
            out.write((int) (v >>> (8 * i)) & 0xFF);
        }
    }
}

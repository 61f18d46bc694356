package org.muma.minikv.rdb;

import java.nio.charset.StandardCharsets;

public class RdbConstants {

    // Header: REDIS0011
    public static final byte[] MAGIC = "REDIS".getBytes(StandardCharsets.UTF_8);
    public static final String VERSION = "0011";
    public static final int VERSION_LENGTH = 4;

    // --- OpCodes (操作码) ---

    // 标识辅助字段 (Auxiliary field)，后跟两个字符串
    public static final int OP_AUX = 0xFA; // 250

    // 标识调整哈希表大小 (Resize DB)，后跟 Key 总数和带过期时间的 Key 数
    public static final int OP_RESIZEDB = 0xFB; // 251

    // 标识过期时间 (毫秒, 8 bytes, 小端)
    public static final int OP_EXPIRETIME_MS = 0xFC; // 252

    // 标识过期时间 (秒, 4 bytes, 小端, 旧版本)
    public static final int OP_EXPIRETIME = 0xFD; // 253

    // 标识数据库选择 (SELECT DB)
    public static final int OP_SELECTDB = 0xFE; // 254

    // 标识 RDB 文件结束，后跟 8 字节校验和
    public static final int OP_EOF = 0xFF; // 255

    // 值类型：只支持字符串
    public static final int TYPE_STRING = 0;

    // --- 长度编码 (高 2 位) ---
    public static final int LEN_6BIT = 0;
    public static final int LEN_14BIT = 1;
    public static final int LEN_32BIT = 2;
    public static final int LEN_ENCVAL = 3;

    // 11xxxxxx 之后低 6 位的特殊编码 (只在辅助字段里接受)
    public static final int ENC_INT8 = 0;
    public static final int ENC_INT16 = 1;
    public static final int ENC_INT32 = 2;

    public static final int CHECKSUM_LENGTH = 8;

    private RdbConstants() {
    }
}

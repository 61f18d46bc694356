package org.muma.minikv.rdb;

import org.muma.minikv.common.RedisData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 把键空间序列化为 RDB 快照 (只在内存中，用于全量同步)
 */
public class RdbSaver {

    private static final Logger log = LoggerFactory.getLogger(RdbSaver.class);

    private static final String REDIS_VERSION = "7.2.0";

    public byte[] dump(Map<String, RedisData> entries) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(256);
        RdbEncoder encoder = new RdbEncoder(bos);
        try {
            // 1. Header: REDIS0011
            encoder.writeBytes(RdbConstants.MAGIC);
            encoder.writeBytes(RdbConstants.VERSION.getBytes(StandardCharsets.UTF_8));

            // 2. 元数据
            encoder.writeByte(RdbConstants.OP_AUX);
            encoder.writeString("redis-ver");
            encoder.writeString(REDIS_VERSION);

            if (!entries.isEmpty()) {
                // 3. Select DB 0 + 哈希表大小
                encoder.writeByte(RdbConstants.OP_SELECTDB);
                encoder.writeLength(0);

                long expires = entries.values().stream().filter(RedisData::hasExpire).count();
                encoder.writeByte(RdbConstants.OP_RESIZEDB);
                encoder.writeLength(entries.size());
                encoder.writeLength(expires);

                // 4. 遍历 Key-Value
                for (Map.Entry<String, RedisData> entry : entries.entrySet()) {
                    RedisData data = entry.getValue();
                    if (data.hasExpire()) {
                        encoder.writeByte(RdbConstants.OP_EXPIRETIME_MS);
                        encoder.writeMillisTimestamp(data.getExpireAt());
                    }
                    encoder.writeByte(RdbConstants.TYPE_STRING);
                    encoder.writeString(entry.getKey());
                    encoder.writeString(data.getPayload());
                }
            }

            // 5. EOF + 校验和 (全 0 表示不校验)
            encoder.writeByte(RdbConstants.OP_EOF);
            encoder.writeBytes(new byte[RdbConstants.CHECKSUM_LENGTH]);
        } catch (IOException e) {
            // ByteArrayOutputStream 不会抛出 IO 异常
            throw new UncheckedIOException(e);
        }

        byte[] snapshot = bos.toByteArray();
        log.debug("RDB snapshot generated. Keys: {}, Size: {} bytes", entries.size(), snapshot.length);
        return snapshot;
    }
}

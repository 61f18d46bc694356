package org.muma.minikv.rdb;

import org.muma.minikv.common.RedisData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * RDB 快照加载器
 * 解析出快照中所有未过期的 Key-Value，加载时已经过期的记录直接丢弃。
 */
public class RdbLoader {

    private static final Logger log = LoggerFactory.getLogger(RdbLoader.class);

    private final LongSupplier clock;

    public RdbLoader() {
        this(System::currentTimeMillis);
    }

    public RdbLoader(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * 读取整个文件后解析。文件不存在时返回空结果。
     */
    public Map<String, RedisData> load(File file) throws IOException {
        if (!file.exists()) {
            log.info("RDB file {} not found, starting with an empty keyspace", file.getPath());
            return new HashMap<>();
        }

        log.info("Loading RDB file: {}", file.getPath());
        long start = System.currentTimeMillis();
        Map<String, RedisData> entries = parse(Files.readAllBytes(file.toPath()));
        log.info("RDB loaded. Keys: {}, Duration: {} ms", entries.size(), System.currentTimeMillis() - start);
        return entries;
    }

    public Map<String, RedisData> parse(byte[] snapshot) throws RdbLoadException {
        try {
            return doParse(new RdbDecoder(snapshot));
        } catch (RdbLoadException e) {
            throw e;
        } catch (EOFException e) {
            throw new RdbLoadException("Truncated RDB snapshot", e);
        } catch (IOException e) {
            throw new RdbLoadException("Failed to read RDB snapshot", e);
        }
    }

    private Map<String, RedisData> doParse(RdbDecoder decoder) throws IOException {
        // 1. Check Magic "REDIS"
        byte[] magic = decoder.readBytes(RdbConstants.MAGIC.length);
        if (!Arrays.equals(magic, RdbConstants.MAGIC)) {
            throw new RdbLoadException("Invalid RDB file: Bad Magic");
        }

        // 2. Version (4 位 ASCII 数字)，不校验具体版本
        byte[] version = decoder.readBytes(RdbConstants.VERSION_LENGTH);
        for (byte b : version) {
            if (b < '0' || b > '9') {
                throw new RdbLoadException("Invalid RDB version");
            }
        }

        long now = clock.getAsLong();
        Map<String, RedisData> entries = new HashMap<>();
        long expireAt = RedisData.NO_EXPIRE; // 当前 Key 的过期时间
        int skipped = 0;

        // 3. Loop Opcodes
        while (true) {
            int type = decoder.readByte();

            if (type == RdbConstants.OP_EOF) {
                // 校验和不做验证
                break;
            } else if (type == RdbConstants.OP_AUX) {
                String name = decoder.readAuxString();
                String value = decoder.readAuxString();
                log.debug("RDB aux field {}={}", name, value);
                continue;
            } else if (type == RdbConstants.OP_SELECTDB) {
                decoder.readLength(); // 只有一个库，DB ID 忽略
                continue;
            } else if (type == RdbConstants.OP_RESIZEDB) {
                long dbSize = decoder.readLength();
                long expiresSize = decoder.readLength();
                log.debug("RDB resizedb: keys={}, expires={}", dbSize, expiresSize);
                continue;
            } else if (type == RdbConstants.OP_EXPIRETIME_MS) {
                expireAt = decoder.readMillisTimestamp();
                continue; // 下一个字节是 ValueType
            } else if (type == RdbConstants.OP_EXPIRETIME) {
                expireAt = decoder.readSecondsTimestamp() * 1000;
                continue;
            } else if (type != RdbConstants.TYPE_STRING) {
                throw new RdbLoadException("Unsupported RDB value type: " + type);
            }

            // --- 读 Key-Value ---
            String key = decoder.readStringUtf8();
            String value = decoder.readStringUtf8();

            RedisData data = new RedisData(value, expireAt);
            expireAt = RedisData.NO_EXPIRE; // 重置

            if (data.isExpired(now)) {
                skipped++;
            } else {
                entries.put(key, data);
            }
        }

        if (skipped > 0) {
            log.info("Skipped {} expired keys while loading RDB", skipped);
        }
        return entries;
    }
}

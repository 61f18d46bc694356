package org.muma.minikv.rdb;

import java.io.IOException;

/**
 * RDB 快照格式不合法：魔数不对、长度编码不支持、数据截断、非法 UTF-8 等
 */
public class RdbLoadException extends IOException {

    public RdbLoadException(String message) {
        super(message);
    }

    public RdbLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

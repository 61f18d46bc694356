package org.muma.minikv.replication;

import lombok.Getter;
import lombok.Setter;

/**
 * 复制元数据
 * Master 和 Slave 都需要维护
 */
public class ReplicationMetadata {

    // 固定的 40 位十六进制复制 ID
    public static final String DEFAULT_REPL_ID = "8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb";

    @Getter
    private final String myReplId;

    // Master 不维护复制积压，偏移量固定为 0
    @Getter
    private final long replOffset = 0;

    // Master 的 Host/Port (仅 Slave 模式有效)
    @Getter
    private String masterHost;
    @Getter
    private int masterPort = -1;

    // FULLRESYNC 时 Master 告知的 ID 和偏移量
    @Setter
    @Getter
    private volatile String masterReplId = "?";
    @Setter
    @Getter
    private volatile long masterOffset = -1;

    public ReplicationMetadata() {
        this(DEFAULT_REPL_ID);
    }

    public ReplicationMetadata(String myReplId) {
        this.myReplId = myReplId;
    }

    public void setMaster(String host, int port) {
        this.masterHost = host;
        this.masterPort = port;
    }

    public boolean isSlave() {
        return masterHost != null;
    }
}

package org.muma.minikv.replication;

/**
 * 一个从节点的输出通道
 */
public interface ReplicaHandle {

    /**
     * 尝试发送一条已编码的命令
     *
     * @return 是否成功交给底层连接
     */
    boolean send(byte[] command);

    // 连接是否还活着，断开的会在下一次传播时被清理
    boolean isActive();

    String describe();
}

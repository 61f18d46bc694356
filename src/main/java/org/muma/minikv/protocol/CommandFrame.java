package org.muma.minikv.protocol;

import java.util.List;

/**
 * 入站命令帧：Bulk String 数组解析后的参数列表，以及它在线上占用的字节数
 * (从节点用它累计复制偏移量)。
 */
public record CommandFrame(List<String> args, int wireLength) {

    public String name() {
        return args.isEmpty() ? "" : args.get(0);
    }
}

package org.muma.minikv.protocol;

/**
 * 一次解码的结果：解析出的值 + 实际消耗的字节数
 */
public record Decoded<T>(T value, int consumed) {
}

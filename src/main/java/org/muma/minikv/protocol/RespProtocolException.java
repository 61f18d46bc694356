package org.muma.minikv.protocol;

/**
 * 帧格式错误：类型标识不对、长度不是数字、缺少 CRLF 等
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(String message) {
        super(message);
    }
}

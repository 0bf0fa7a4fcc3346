package com.nei10u.cosmic.exception;

/**
 * 远程星历调用失败：超时、非 2xx、报文无法解析或不完整。只在星历模块内部流转，由本地计算兜底。
 */
public class RemoteEphemerisException extends RuntimeException {

    public RemoteEphemerisException(String message) {
        super(message);
    }

    public RemoteEphemerisException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.nei10u.cosmic.exception;

/**
 * 任一体系计算失败时整次构建失败，绝不返回残缺的指纹。
 */
public class FingerprintBuildException extends RuntimeException {

    private final String component;

    public FingerprintBuildException(String component, String message, Throwable cause) {
        super(message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}

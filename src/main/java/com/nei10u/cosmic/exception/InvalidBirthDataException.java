package com.nei10u.cosmic.exception;

/**
 * 出生数据不合法（日期不存在、坐标越界、需要宫位却缺坐标等）。立即失败，不做默认值替换。
 */
public class InvalidBirthDataException extends RuntimeException {

    public InvalidBirthDataException(String message) {
        super(message);
    }

    public InvalidBirthDataException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lyz.trainplan.common.exception;

import lombok.Getter;

/**
 * 业务错误码，附带对应的 HTTP 状态
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR(400, "VALIDATION_ERROR"),
    NOT_FOUND(404, "NOT_FOUND");

    private final int httpStatus;
    private final String code;

    ErrorCode(int httpStatus, String code) {
        this.httpStatus = httpStatus;
        this.code = code;
    }
}

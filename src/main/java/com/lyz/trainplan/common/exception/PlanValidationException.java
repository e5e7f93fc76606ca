package com.lyz.trainplan.common.exception;

/**
 * 计划文档格式错误或为空，落库前即拒绝
 */
public class PlanValidationException extends BaseException {

    public PlanValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public PlanValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}

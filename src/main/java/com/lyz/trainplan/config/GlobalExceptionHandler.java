package com.lyz.trainplan.config;

import com.lyz.trainplan.common.Result;
import com.lyz.trainplan.common.exception.BaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 业务异常，HTTP 状态取自错误码
     */
    @ExceptionHandler(BaseException.class)
    public ResponseEntity<Result<Object>> handleBaseException(BaseException e) {
        int status = e.getErrorCode().getHttpStatus();
        log.warn("业务异常 [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
        return ResponseEntity.status(status).body(Result.error(status, e.getMessage()));
    }

    /**
     * 请求体校验失败（返回400）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Object>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("参数校验失败: {}", message);
        return badRequest(message);
    }

    /**
     * 请求体无法解析、参数缺失或类型错误（返回400）
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Result<Object>> handleBadRequest(Exception e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return badRequest("请求参数错误");
    }

    /**
     * 处理参数异常（返回400）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Object>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("参数错误: {}", e.getMessage());
        return badRequest(e.getMessage());
    }

    /**
     * 持久化异常不重试，直接返回500
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Result<Object>> handleDataAccessException(DataAccessException e) {
        log.error("数据访问异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Result.error("数据访问异常，请稍后重试"));
    }

    /**
     * 处理所有异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Object>> handleException(Exception e) {
        log.error("系统异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Result.error("系统异常，请稍后重试"));
    }

    private ResponseEntity<Result<Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Result.error(400, message));
    }
}

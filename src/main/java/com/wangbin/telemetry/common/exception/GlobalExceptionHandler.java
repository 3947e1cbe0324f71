package com.wangbin.telemetry.common.exception;

import com.wangbin.telemetry.common.web.result.ApiResult;
import com.wangbin.telemetry.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理遥测异常
     */
    @ExceptionHandler(TelemetryException.class)
    public ApiResult<?> handleTelemetryException(TelemetryException e, HttpServletRequest request) {
        if (e.getResultCode().isClientError()) {
            log.warn("请求参数异常 - Resource: {}, Code: {}, Message: {}",
                    e.getResourceKey(), e.getCode(), e.getMessage());
        } else {
            log.error("遥测异常 - Resource: {}, Code: {}", e.getResourceKey(), e.getCode(), e);
        }

        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        if (e.getResourceKey() != null) {
            result.addExtra("resourceKey", e.getResourceKey());
        }
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数缺失与类型转换异常
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ApiResult<?> handleParameterException(Exception e, HttpServletRequest request) {
        log.warn("参数异常: {} {}", request.getRequestURI(), e.getMessage());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), e.getMessage());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), "系统内部错误，请联系管理员");
    }
}

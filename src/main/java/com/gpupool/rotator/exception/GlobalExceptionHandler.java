package com.gpupool.rotator.exception;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<String> handleValidation(ValidationException e) {
        log.warn("参数校验失败: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "invalid_request_error", e.getMessage());
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<String> handleNotFound(AccountNotFoundException e) {
        log.warn("账号不存在: {}", e.getAccountId());
        return buildErrorResponse(e.getStatusCode(), "not_found_error", e.getMessage());
    }

    @ExceptionHandler(IneligibleAccountException.class)
    public ResponseEntity<String> handleIneligible(IneligibleAccountException e) {
        log.warn("账号状态不允许该操作: id={}, status={}, {}", e.getAccountId(), e.getStatus(), e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "conflict_error", e.getMessage());
    }

    @ExceptionHandler(PoolExhaustedException.class)
    public ResponseEntity<String> handleExhausted(PoolExhaustedException e) {
        log.warn("无可用账号: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "overloaded_error", e.getMessage());
    }

    @ExceptionHandler(ProvisioningException.class)
    public ResponseEntity<String> handleProvisioning(ProvisioningException e) {
        log.error("节点操作失败: account={}, fatal={}, {}", e.getAccountId(), e.isFatal(), e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "provisioning_error", e.getMessage());
    }

    @ExceptionHandler(PoolException.class)
    public ResponseEntity<String> handlePool(PoolException e) {
        log.error("账号池异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(), "pool_error", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            log.warn("路由未找到: {}", e.getReason());
        } else {
            log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        }
        return buildErrorResponse(statusCode, statusCode == 404 ? "not_found_error" : "invalid_request_error",
                e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "internal_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        JSONObject body = JSONObject.of(
                "type", "error", //
                "error", JSONObject.of( //
                        "type", errorType, //
                        "message", message //
                ) //
        );
        return ResponseEntity
                .status(HttpStatus.valueOf(Math.min(statusCode, 599)))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}

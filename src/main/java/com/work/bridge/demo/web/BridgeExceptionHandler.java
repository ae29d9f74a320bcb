package com.work.bridge.demo.web;

import com.work.bridge.core.exception.AccommodationValidationFailureException;
import com.work.bridge.core.exception.BridgeAccessDeniedException;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.exception.InappropriateRelocationStatusException;
import com.work.bridge.core.execution.WorkerQueueChainExecutor;
import com.work.bridge.demo.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * BridgeException → HTTP：参数错误 400，状态冲突 409，权限 403，暂停 / 排队失败 / 等锁超时 503。
 */
@RestControllerAdvice
public class BridgeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BridgeExceptionHandler.class);

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<ErrorResponse> handleBridge(BridgeException e) {
        log.warn("bridge operation rejected code={} msg={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(statusOf(e.getCode()))
                .body(new ErrorResponse(e.getCode().name(), e.getMessage(), detailsOf(e)));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<ErrorResponse> handleInvalid(Exception e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(WorkerQueueChainExecutor.DispatchRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(WorkerQueueChainExecutor.DispatchRejectedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse("DISPATCH_REJECTED", e.getMessage()));
    }

    @ExceptionHandler(WorkerQueueChainExecutor.DispatchTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(WorkerQueueChainExecutor.DispatchTimeoutException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse("DISPATCH_TIMEOUT", e.getMessage()));
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleLockFailure(PessimisticLockingFailureException e) {
        log.warn("bridge operation lock failure msg={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse("LOCK_UNAVAILABLE", e.getMessage()));
    }

    static HttpStatus statusOf(BridgeErrorCode code) {
        switch (code) {
            case ACCESS_DENIED:
            case NOT_BRIDGE:
                return HttpStatus.FORBIDDEN;
            case PAUSED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return code.isStateError() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        }
    }

    private static Map<String, Object> detailsOf(BridgeException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (e instanceof InappropriateRelocationStatusException) {
            InappropriateRelocationStatusException ex = (InappropriateRelocationStatusException) e;
            details.put("currentStatus", ex.getCurrentStatus());
        } else if (e instanceof AccommodationValidationFailureException) {
            AccommodationValidationFailureException ex = (AccommodationValidationFailureException) e;
            details.put("index", ex.getIndex());
            details.put("validationStatus", ex.getValidationStatus());
        } else if (e instanceof BridgeAccessDeniedException) {
            BridgeAccessDeniedException ex = (BridgeAccessDeniedException) e;
            details.put("caller", ex.getCaller());
            details.put("role", ex.getRole());
        }
        return details.isEmpty() ? null : details;
    }
}

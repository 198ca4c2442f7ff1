package com.zzf.toolhost.api;

import com.zzf.toolhost.mcp.error.CircuitOpenException;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.error.ProviderTimeoutException;
import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import com.zzf.toolhost.mcp.error.ServerNotFoundException;
import com.zzf.toolhost.mcp.error.ServerUnavailableException;
import com.zzf.toolhost.mcp.error.ToolProviderException;
import com.zzf.toolhost.mcp.gate.GateTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public final class GlobalExceptionHandler {

    @ExceptionHandler(ToolProviderException.class)
    public ResponseEntity<ErrorResponse> handleToolProviderException(ToolProviderException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("api.error code={} server={} err={}", e.getErrorCode(), e.getServerId(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknownException(Exception e) {
        log.error("api.unhandled", e);
        String msg = e.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            msg = e.getClass().getSimpleName();
        } else {
            msg = e.getClass().getSimpleName() + ": " + msg;
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(new ErrorResponse("INTERNAL_ERROR", msg));
    }

    static HttpStatus statusOf(ToolProviderException e) {
        if (e instanceof ServerNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof QuarantinedServerException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof ConfigurationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof ServerUnavailableException || e instanceof CircuitOpenException
                || e instanceof GateTimeoutException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (e instanceof ProviderTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}

package com.reqminer.dispatch.api;

import com.reqminer.core.engine.InvalidMiningRequestException;
import com.reqminer.core.engine.MiningWorkflowException;
import com.reqminer.core.engine.SessionBusyException;
import com.reqminer.core.engine.SessionNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP status codes and a JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidMiningRequestException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}",
                request.getRequestURI(), ex.getClass().getSimpleName(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException ex) {
        var response = body(HttpStatus.NOT_FOUND, ex.getMessage());
        response.getBody().put("session_id", ex.getSessionId());
        return response;
    }

    @ExceptionHandler(SessionBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(SessionBusyException ex) {
        var response = body(HttpStatus.CONFLICT, ex.getMessage());
        response.getBody().put("session_id", ex.getSessionId());
        return response;
    }

    @ExceptionHandler(MiningWorkflowException.class)
    public ResponseEntity<Map<String, Object>> handleWorkflowFailure(MiningWorkflowException ex) {
        log.error("Mining workflow failed for session {} at {}: {}",
                ex.getSessionId(), ex.getFailedNode(), ex.getMessage());
        var response = body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
        response.getBody().put("session_id", ex.getSessionId());
        response.getBody().put("failed_node", ex.getFailedNode());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message != null ? message : status.getReasonPhrase());
        return ResponseEntity.status(status).body(body);
    }
}

package com.fitcycle.backend.common.web;

import com.fitcycle.backend.plan.web.PlanConfigurationException;
import com.fitcycle.backend.plan.web.PlanValidationException;
import com.fitcycle.backend.plan.web.SheetFetchException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.DateTimeException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 503：計畫沒載入 / 設定不完整，讀取端無法算出今天 =====

    @ExceptionHandler(PlanConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handlePlanConfig(PlanConfigurationException ex, HttpServletRequest req) {
        Map<String, Object> body = err("PLAN_UNAVAILABLE", ex.getMessage(), req);
        body.put("reason", ex.code());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    // ===== 422：sync 內容或規則欄位不合法 =====

    @ExceptionHandler(PlanValidationException.class)
    public ResponseEntity<Map<String, Object>> handlePlanValidation(PlanValidationException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(err(ex.code(), ex.getMessage(), req));
    }

    // ===== 502：sheet 匯出抓不到 =====

    @ExceptionHandler(SheetFetchException.class)
    public ResponseEntity<Map<String, Object>> handleSheet(SheetFetchException ex, HttpServletRequest req) {
        log.warn("Sheet fetch failed: status={}, message={}, snippet={}",
                ex.getStatus(), ex.getMessage(), ex.getBodySnippet());
        Map<String, Object> body = err("SHEET_FETCH_FAILED", ex.getMessage(), req);
        body.put("upstreamStatus", ex.getStatus());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    // ===== 400 =====

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest req) {
        String code = norm(ex.getMessage(), "BAD_REQUEST");
        return ResponseEntity.badRequest().body(err(code, ex.getMessage(), req));
    }

    @ExceptionHandler(DateTimeException.class)
    public ResponseEntity<Map<String, Object>> handleDateTime(DateTimeException ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("DATE_TIME_INVALID", ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors();
        String msg = fieldErrors.isEmpty()
                ? "VALIDATION_FAILED"
                : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    // ===== 404 =====

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuch(NoSuchElementException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err(norm(ex.getMessage(), "NOT_FOUND"), ex.getMessage(), req));
    }

    // ===== 原樣轉出（401 / 403 等） =====

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatusCode status = ex.getStatusCode();
        String code = norm(ex.getReason(), String.valueOf(status.value()));
        return ResponseEntity.status(status).body(err(code, ex.getReason(), req));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", ex.getMessage(), req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }

    private static String norm(String s, String fallback) {
        if (s == null || s.isBlank()) return fallback;
        return s.trim();
    }
}

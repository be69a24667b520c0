package alertthreader.web;

import alertthreader.threader.ThreadStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable alert batch: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON");
    }

    @ExceptionHandler(InvalidAlertBatchException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBatch(InvalidAlertBatchException e) {
        log.warn("Rejected alert batch: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ThreadStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStoreFailure(ThreadStoreException e) {
        log.error("Thread store operation failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}

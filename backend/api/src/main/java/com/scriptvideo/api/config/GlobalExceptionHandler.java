package com.scriptvideo.api.config;

import com.scriptvideo.common.dto.ApiResponse;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ConsistencyException;
import com.scriptvideo.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.List;
import java.util.UUID;

/**
 * 전역 예외 처리기
 * - 요청 검증 실패/리소스 없음은 에러 코드 그대로 응답
 * - 내부 결함(ConsistencyException)과 예상치 못한 예외는 요청 ID 와 함께 로그
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 처리 - 동기 요청 처리 중 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<List<String>>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[{}] API exception - code: {} ({}), uri: {}, message: {}",
                    requestId, errorCode.getCode(), errorCode.name(), request.getDescription(false), e.getMessage(), e);
        } else {
            log.warn("[{}] API exception - code: {} ({}), uri: {}, message: {}, details: {}",
                    requestId, errorCode.getCode(), errorCode.name(), request.getDescription(false),
                    e.getMessage(), e.getDetails());
        }

        String userMessage = buildUserMessage(errorCode, e.getMessage(), requestId);
        List<String> details = e.getDetails().isEmpty() ? null : e.getDetails();
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, userMessage, details));
    }

    /**
     * Bean Validation 실패 - 필수 필드 누락 등
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<List<String>>> handleValidation(MethodArgumentNotValidException e) {
        String requestId = generateRequestId();
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        log.warn("[{}] Validation failed: {}", requestId, details);

        ErrorCode errorCode = ErrorCode.VALIDATION_FAILED;
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, null, requestId), details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        String requestId = generateRequestId();
        log.warn("[{}] Unreadable request body: {}", requestId, e.getMostSpecificCause().getMessage());

        ErrorCode errorCode = ErrorCode.INVALID_REQUEST;
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, "요청 본문을 읽을 수 없습니다.", requestId)));
    }

    /**
     * ConsistencyException 처리 - 상태 전이 위반 등 내부 결함
     */
    @ExceptionHandler(ConsistencyException.class)
    public ResponseEntity<ApiResponse<Void>> handleConsistency(ConsistencyException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();
        log.error("[{}] Consistency error - code: {}, uri: {}", requestId, errorCode.name(),
                request.getDescription(false), e);

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, null, requestId)));
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();
        log.error("[{}] Unexpected exception - type: {}, uri: {}, message: {}",
                requestId, e.getClass().getName(), request.getDescription(false), e.getMessage(), e);

        String userMessage = String.format(
            "서버 오류가 발생했습니다. [요청 ID: %s] 문제가 지속되면 관리자에게 문의해주세요.",
            requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }
}

package com.devstore.global.exception;

import com.devstore.global.dto.ValidationProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.BindException;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * REST API 예외 핸들러.
 *
 * 장바구니 업무 오류는 오케스트레이터가 누적해 결과 값으로 돌려주므로 여기까지 오지 않는다.
 * 이 핸들러는 바인딩 단계 오류(본문 검증, 잘못된 JSON, 경로 변수 형식), 인증 누락, 예상하지 못한 오류를
 * 장바구니 실패 응답과 같은 {@link ValidationProblem} 형식으로 변환한다.
 */
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ValidationProblem> handleBusiness(BusinessException e) {
        log.warn("API Business error [{}]: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ValidationProblem.of(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    /**
     * 필드 오류를 첫 번째만이 아니라 전부 담는다. MethodArgumentNotValidException도 BindException의 하위 타입이다.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ValidationProblem> handleValidation(BindException e) {
        List<String> messages = e.getBindingResult().getAllErrors().stream()
                .map(ObjectError::getDefaultMessage)
                .toList();
        if (messages.isEmpty()) {
            messages = List.of("입력값이 올바르지 않습니다.");
        }
        log.warn("API Validation error: {}", messages);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ValidationProblem.of(HttpStatus.BAD_REQUEST, messages));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationProblem> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("API Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ValidationProblem.of(HttpStatus.BAD_REQUEST, "요청 본문 형식이 올바르지 않습니다."));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ValidationProblem> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("API Type mismatch: {}={}", e.getName(), e.getValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ValidationProblem.of(HttpStatus.BAD_REQUEST, e.getName() + " 값의 형식이 올바르지 않습니다."));
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ValidationProblem> handleAuthentication(AuthenticationException e) {
        log.warn("API Authentication required: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ValidationProblem.of(HttpStatus.UNAUTHORIZED, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ValidationProblem> handleGeneral(Exception e) {
        log.error("API Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ValidationProblem.of(HttpStatus.INTERNAL_SERVER_ERROR, "서버 오류가 발생했습니다."));
    }
}

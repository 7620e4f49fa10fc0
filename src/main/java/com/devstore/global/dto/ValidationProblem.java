package com.devstore.global.dto;

import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * 실패 응답 본문.
 *
 * 요청 하나에서 누적된 오류를 첫 번째만이 아니라 전부 담아 클라이언트가 한 번에 수정할 수 있게 한다.
 *
 * 형식: { "title": "...", "status": 400, "errors": { "Messages": [ "...", "..." ] } }
 */
public record ValidationProblem(
        String title,
        int status,
        Map<String, List<String>> errors
) {
    public static final String MESSAGES_KEY = "Messages";

    public static ValidationProblem of(HttpStatus status, List<String> messages) {
        return new ValidationProblem(titleFor(status), status.value(), Map.of(MESSAGES_KEY, List.copyOf(messages)));
    }

    public static ValidationProblem of(HttpStatus status, String message) {
        return of(status, List.of(message));
    }

    public List<String> messages() {
        return errors.getOrDefault(MESSAGES_KEY, List.of());
    }

    private static String titleFor(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "요청한 리소스를 찾을 수 없습니다.";
            case CONFLICT -> "다른 요청과 충돌했습니다.";
            case UNAUTHORIZED -> "인증이 필요합니다.";
            case INTERNAL_SERVER_ERROR -> "서버 오류가 발생했습니다.";
            default -> "하나 이상의 검증 오류가 발생했습니다.";
        };
    }
}

package com.devstore.domain.cart.service;

import com.devstore.domain.cart.exception.CartErrorType;
import java.util.List;

/**
 * 장바구니 변경 요청의 최종 응답 값.
 * 성공 시 payload(없을 수 있음), 실패 시 누적된 오류 전체를 담는다.
 */
public record CartOperationResult<T>(T payload, List<CartError> errors) {

    public static <T> CartOperationResult<T> success(T payload) {
        return new CartOperationResult<>(payload, List.of());
    }

    public static <T> CartOperationResult<T> failure(ErrorAccumulator accumulator) {
        return new CartOperationResult<>(null, List.copyOf(accumulator.getErrors()));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public List<String> messages() {
        return errors.stream().map(CartError::message).toList();
    }

    public boolean hasOnly(CartErrorType type) {
        return !errors.isEmpty() && errors.stream().allMatch(error -> error.type() == type);
    }

    public boolean has(CartErrorType type) {
        return errors.stream().anyMatch(error -> error.type() == type);
    }
}

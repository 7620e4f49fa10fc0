package com.devstore.domain.cart.service;

import com.devstore.domain.cart.exception.CartErrorType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 요청 단위 오류 수집기.
 *
 * 오케스트레이션 호출마다 새로 생성되어 바인딩 → 변경 → 검증 → 저장 단계에 명시적으로 전달된다.
 * 빈 상태일 때만 저장 단계로 진행할 수 있다. 스레드 간에 공유하지 않는다.
 */
public final class ErrorAccumulator {

    private final List<CartError> errors = new ArrayList<>();

    public void add(CartErrorType type, String message) {
        errors.add(new CartError(type, message));
    }

    public void addAll(CartErrorType type, Collection<String> messages) {
        messages.forEach(message -> add(type, message));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public boolean contains(CartErrorType type) {
        return errors.stream().anyMatch(error -> error.type() == type);
    }

    public List<CartError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getMessages() {
        return errors.stream().map(CartError::message).toList();
    }
}

package com.devstore.domain.cart.exception;

import com.devstore.global.exception.BusinessException;

import java.util.List;

/**
 * 장바구니 집계가 변경 요청을 거부할 때 발생한다.
 * 거부된 변경은 상태에 반영되지 않으며, 위반 메시지는 요청의 ErrorAccumulator로 옮겨진다.
 */
public class CartRuleViolationException extends BusinessException {

    private final CartErrorType errorType;
    private final List<String> messages;

    public CartRuleViolationException(CartErrorType errorType, String message) {
        this(errorType, List.of(message));
    }

    public CartRuleViolationException(CartErrorType errorType, List<String> messages) {
        super(errorType.name(), String.join(" ", messages));
        this.errorType = errorType;
        this.messages = List.copyOf(messages);
    }

    public CartErrorType getErrorType() {
        return errorType;
    }

    public List<String> getMessages() {
        return messages;
    }
}

package com.devstore.domain.cart.entity;

import java.util.List;

/**
 * 장바구니 규칙 검사 결과. 위반 메시지가 없으면 유효하다.
 */
public record CartValidationResult(List<String> errors) {

    public CartValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}

package com.devstore.domain.cart.dto;

import com.devstore.domain.cart.entity.CartItem;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 장바구니 항목 추가/수량 변경 요청 DTO.
 *
 * 수량 범위와 가격 규칙은 집계가 검사한다. 여기서는 바인딩 조건과 컬럼 크기 한도만 본다.
 * 수량 변경 요청은 productId와 quantity만 사용한다.
 */
public record CartItemRequest(
        @NotNull(message = "상품 ID는 필수입니다.")
        UUID productId,

        @Size(max = 200, message = "상품명은 200자 이하로 입력해주세요.")
        String name,

        @Digits(integer = 10, fraction = 2, message = "가격 형식이 올바르지 않습니다.")
        BigDecimal price,

        @Size(max = 500, message = "이미지 경로는 500자 이하로 입력해주세요.")
        String image,

        @NotNull(message = "수량은 필수입니다.")
        Integer quantity
) {
    public CartItem toEntity() {
        return new CartItem(productId, name, image, price, quantity);
    }
}

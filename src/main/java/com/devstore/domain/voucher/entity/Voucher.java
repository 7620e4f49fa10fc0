package com.devstore.domain.voucher.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 적용 요청된 바우처 값.
 *
 * 바우처의 원본은 장바구니 바깥에서 관리된다. 장바구니는 할인 계산에 필요한 값만 복사해 보관하며
 * expirationDate, active, firstTimeUseOnly는 적용 시점 판정에만 쓰인다.
 *
 * @param percentage discountType이 PERCENTAGE일 때만 사용
 * @param value      discountType이 FIXED_VALUE일 때만 사용
 */
public record Voucher(
        String code,
        DiscountType discountType,
        BigDecimal percentage,
        BigDecimal value,
        LocalDateTime expirationDate,
        boolean active,
        boolean firstTimeUseOnly
) {
}

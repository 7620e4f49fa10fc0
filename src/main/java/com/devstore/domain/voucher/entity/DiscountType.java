package com.devstore.domain.voucher.entity;

/**
 * 바우처 할인 유형.
 * 장바구니 테이블에는 @Enumerated(EnumType.STRING)으로 'PERCENTAGE', 'FIXED_VALUE'가 저장된다.
 */
public enum DiscountType {

    /** 정률 할인: 장바구니 금액의 percentage% 차감 */
    PERCENTAGE,

    /** 정액 할인: value만큼 차감하되 장바구니 금액을 넘지 않음 */
    FIXED_VALUE
}

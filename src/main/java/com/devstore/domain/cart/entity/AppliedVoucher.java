package com.devstore.domain.cart.entity;

import com.devstore.domain.voucher.entity.DiscountType;
import com.devstore.domain.voucher.entity.Voucher;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.math.BigDecimal;

/**
 * 장바구니에 적용된 바우처의 값 복사본.
 * 할인 금액 재계산에 필요한 값만 보관하며, 바우처 원본을 참조하지 않는다.
 */
@Embeddable
public class AppliedVoucher {

    @Column(name = "voucher_code", length = 50)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "voucher_discount_type", length = 20)
    private DiscountType discountType;

    @Column(name = "voucher_percentage", precision = 5, scale = 2)
    private BigDecimal percentage;

    @Column(name = "voucher_value", precision = 12, scale = 2)
    private BigDecimal value;

    protected AppliedVoucher() {}

    private AppliedVoucher(String code, DiscountType discountType, BigDecimal percentage, BigDecimal value) {
        this.code = code;
        this.discountType = discountType;
        this.percentage = percentage;
        this.value = value;
    }

    public static AppliedVoucher copyOf(Voucher voucher) {
        return new AppliedVoucher(
                voucher.code(),
                voucher.discountType(),
                voucher.discountType() == DiscountType.PERCENTAGE ? voucher.percentage() : null,
                voucher.discountType() == DiscountType.FIXED_VALUE ? voucher.value() : null);
    }

    public String getCode() { return code; }
    public DiscountType getDiscountType() { return discountType; }
    public BigDecimal getPercentage() { return percentage; }
    public BigDecimal getValue() { return value; }
}

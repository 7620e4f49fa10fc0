package com.devstore.domain.cart.dto;

import com.devstore.domain.cart.entity.AppliedVoucher;
import com.devstore.domain.cart.entity.CustomerShoppingCart;
import com.devstore.domain.voucher.entity.DiscountType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * 장바구니 조회 응답 DTO.
 * 항목 목록, 합계 금액, 할인 금액, 적용 바우처를 단일 응답으로 제공한다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CartResponse(
        UUID id,
        UUID customerId,
        List<CartItemResponse> items,
        BigDecimal amount,
        BigDecimal discount,
        boolean hasVoucher,
        VoucherSummary voucher
) {
    public record VoucherSummary(String code, DiscountType discountType, BigDecimal percentage, BigDecimal value) {

        static VoucherSummary from(AppliedVoucher voucher) {
            if (voucher == null) {
                return null;
            }
            return new VoucherSummary(voucher.getCode(), voucher.getDiscountType(),
                    voucher.getPercentage(), voucher.getValue());
        }
    }

    public static CartResponse from(CustomerShoppingCart cart) {
        return new CartResponse(
                cart.getId(),
                cart.getCustomerId(),
                cart.getItems().stream().map(CartItemResponse::from).toList(),
                cart.getAmount(),
                cart.getDiscount(),
                cart.hasVoucher(),
                VoucherSummary.from(cart.getVoucher())
        );
    }
}

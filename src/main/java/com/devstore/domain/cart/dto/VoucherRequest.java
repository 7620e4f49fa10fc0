package com.devstore.domain.cart.dto;

import com.devstore.domain.voucher.entity.DiscountType;
import com.devstore.domain.voucher.entity.Voucher;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 바우처 적용 요청 DTO.
 */
public record VoucherRequest(
        @NotBlank(message = "바우처 코드는 필수입니다.")
        @Size(max = 50, message = "바우처 코드는 50자 이하로 입력해주세요.")
        String code,

        @NotNull(message = "할인 유형은 필수입니다.")
        DiscountType discountType,

        @Digits(integer = 3, fraction = 2, message = "할인율 형식이 올바르지 않습니다.")
        BigDecimal percentage,

        @Digits(integer = 10, fraction = 2, message = "할인 금액 형식이 올바르지 않습니다.")
        BigDecimal value,

        LocalDateTime expirationDate,

        boolean active,

        boolean firstTimeUseOnly
) {
    public Voucher toVoucher() {
        return new Voucher(code, discountType, percentage, value, expirationDate, active, firstTimeUseOnly);
    }
}

package com.devstore.domain.voucher.service;

import com.devstore.domain.voucher.entity.DiscountType;
import com.devstore.domain.voucher.entity.Voucher;
import com.devstore.global.common.ColumnLimits;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 바우처 적용 가능 여부 판정과 할인 금액 계산 전담 컴포넌트.
 *
 * 할인 계산은 외부 의존성이 없는 순수 계산이다. 적용 가능 여부는 주입된 Clock 기준 현재 시각으로 판정하므로
 * 테스트에서 시간을 고정할 수 있다.
 */
@Component
public class VoucherPolicy {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final int MONEY_SCALE = 2;

    private final Clock clock;

    public VoucherPolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * 바우처가 지금 적용 가능한지 판정한다. 불가 사유는 하나에서 멈추지 않고 모두 수집한다.
     *
     * @param voucher            적용 요청된 바우처
     * @param alreadyRedeemed    고객이 이 코드를 이미 사용했는지 (사용 이력 조회 결과)
     */
    public VoucherEligibility evaluate(Voucher voucher, boolean alreadyRedeemed) {
        List<String> reasons = new ArrayList<>();

        if (voucher.code() == null || voucher.code().isBlank()) {
            reasons.add("바우처 코드가 입력되지 않았습니다.");
        } else if (ColumnLimits.exceedsLength(voucher.code(), ColumnLimits.VOUCHER_CODE_LENGTH)) {
            reasons.add("바우처 코드는 " + ColumnLimits.VOUCHER_CODE_LENGTH + "자 이하여야 합니다.");
        }
        if (!voucher.active()) {
            reasons.add("사용할 수 없는 바우처입니다.");
        }
        if (isExpired(voucher.expirationDate())) {
            reasons.add("만료된 바우처입니다.");
        }
        if (voucher.discountType() == null) {
            reasons.add("바우처 할인 유형이 지정되지 않았습니다.");
        } else if (voucher.discountType() == DiscountType.PERCENTAGE) {
            BigDecimal percentage = voucher.percentage();
            if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(ONE_HUNDRED) > 0) {
                reasons.add("정률 할인 바우처의 할인율은 0 초과 100 이하여야 합니다.");
            } else if (!ColumnLimits.fitsPercentage(percentage)) {
                reasons.add("정률 할인 바우처의 할인율은 소수 " + ColumnLimits.FRACTION_DIGITS + "자리 이내여야 합니다.");
            }
        } else if (voucher.value() == null || voucher.value().signum() <= 0) {
            reasons.add("정액 할인 바우처의 할인 금액은 0보다 커야 합니다.");
        } else if (!ColumnLimits.fitsMoney(voucher.value())) {
            reasons.add("정액 할인 바우처의 할인 금액은 정수 " + ColumnLimits.MONEY_INTEGER_DIGITS
                    + "자리, 소수 " + ColumnLimits.FRACTION_DIGITS + "자리 이내여야 합니다.");
        }
        if (voucher.firstTimeUseOnly() && alreadyRedeemed) {
            reasons.add("첫 구매 전용 바우처는 한 번만 사용할 수 있습니다.");
        }

        return reasons.isEmpty() ? VoucherEligibility.eligible() : VoucherEligibility.ineligible(reasons);
    }

    /**
     * 장바구니 금액에 대한 할인 금액을 계산한다.
     * 정률: amount × percentage / 100 (소수 둘째 자리 반올림)
     * 정액: min(value, amount) → 할인 후 금액이 음수가 되지 않는다.
     */
    public static BigDecimal computeDiscount(BigDecimal amount, DiscountType discountType,
                                             BigDecimal percentage, BigDecimal value) {
        if (amount == null || amount.signum() <= 0 || discountType == null) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }

        BigDecimal discount;
        if (discountType == DiscountType.PERCENTAGE) {
            BigDecimal rate = percentage == null ? BigDecimal.ZERO : percentage;
            discount = amount.multiply(rate).divide(ONE_HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP);
        } else {
            discount = value == null ? BigDecimal.ZERO : value;
        }

        if (discount.compareTo(amount) > 0) {
            discount = amount;
        }
        return discount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private boolean isExpired(LocalDateTime expirationDate) {
        return expirationDate == null || expirationDate.isBefore(LocalDateTime.now(clock));
    }
}

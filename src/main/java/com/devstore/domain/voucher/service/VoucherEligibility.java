package com.devstore.domain.voucher.service;

import java.util.List;

/**
 * 바우처 적용 가능 여부 판정 결과. 불가 사유를 모두 담는다.
 */
public record VoucherEligibility(List<String> reasons) {

    public static VoucherEligibility eligible() {
        return new VoucherEligibility(List.of());
    }

    public static VoucherEligibility ineligible(List<String> reasons) {
        return new VoucherEligibility(List.copyOf(reasons));
    }

    public boolean isEligible() {
        return reasons.isEmpty();
    }
}

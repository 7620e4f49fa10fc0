package com.devstore.domain.voucher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 사용 이력 연동이 구성되지 않은 환경의 기본 구현.
 * 항상 "사용한 적 없음"으로 응답하며 아무것도 저장하지 않는다.
 */
@Component
public class UnrecordedVoucherRedemptionHistory implements VoucherRedemptionHistory {

    private static final Logger log = LoggerFactory.getLogger(UnrecordedVoucherRedemptionHistory.class);

    @Override
    public boolean hasRedeemed(UUID customerId, String voucherCode) {
        log.debug("Voucher redemption history not connected. customerId={}, code={}", customerId, voucherCode);
        return false;
    }
}

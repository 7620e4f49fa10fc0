package com.devstore.domain.voucher.service;

import java.util.UUID;

/**
 * 고객별 바우처 사용 이력 조회.
 *
 * 사용 이력은 주문 서비스가 소유한다. firstTimeUseOnly 바우처의 적용 가능 여부를 판정할 때만 조회한다.
 */
public interface VoucherRedemptionHistory {

    boolean hasRedeemed(UUID customerId, String voucherCode);
}

package com.devstore.domain.cart.exception;

/**
 * 장바구니 요청 처리 중 누적되는 오류 분류.
 */
public enum CartErrorType {

    /** 수량 범위, 집계 규칙 위반 */
    VALIDATION,

    /** 경로의 상품 ID와 본문의 상품 ID 불일치 */
    IDENTITY_MISMATCH,

    /** 장바구니 또는 항목이 존재하지 않음 */
    NOT_FOUND,

    /** 비활성, 만료, 정책상 사용 불가 바우처 */
    VOUCHER_INELIGIBLE,

    /** 커밋 결과 반영된 행이 없음 */
    PERSISTENCE_FAILURE,

    /** 다른 요청이 같은 장바구니를 먼저 변경함 */
    CONCURRENT_MODIFICATION
}

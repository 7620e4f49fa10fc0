package com.devstore.domain.cart.exception;

import com.devstore.global.exception.BusinessException;

/**
 * 커밋 시점에 다른 요청이 같은 장바구니를 먼저 변경한 것이 확인되면 발생한다.
 */
public class ConcurrentCartModificationException extends BusinessException {

    public ConcurrentCartModificationException(Throwable cause) {
        super("CONCURRENT_MODIFICATION",
                "다른 요청에서 장바구니가 변경되었습니다. 장바구니를 다시 조회한 뒤 시도해주세요.", cause);
    }
}

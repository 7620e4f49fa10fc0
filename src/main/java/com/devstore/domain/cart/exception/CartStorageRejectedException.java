package com.devstore.domain.cart.exception;

import com.devstore.global.exception.BusinessException;

/**
 * 동시 수정이 아닌 이유로 저장소가 값을 거부했을 때 발생한다. (컬럼 길이 초과, 숫자 범위 초과 등)
 */
public class CartStorageRejectedException extends BusinessException {

    public CartStorageRejectedException(Throwable cause) {
        super("STORAGE_REJECTED", "저장할 수 없는 값이 포함되어 있습니다. 입력값을 확인해주세요.", cause);
    }
}

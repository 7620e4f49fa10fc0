package com.devstore.global.security;

import java.util.UUID;

/**
 * 인증이 확인된 고객 식별자. 컨트롤러는 이 타입의 파라미터로만 고객을 받는다.
 */
public record CustomerIdentity(UUID customerId) {
}

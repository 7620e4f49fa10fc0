package com.devstore.domain.cart.service;

import com.devstore.domain.cart.entity.CustomerShoppingCart;
import com.devstore.domain.cart.exception.ConcurrentCartModificationException;

import java.util.Optional;
import java.util.UUID;

/**
 * 장바구니 저장소 경계.
 */
public interface CartPersistenceGateway {

    /**
     * 고객의 장바구니를 항목까지 함께 조회한다. 반환된 객체는 영속성 컨텍스트와 분리되어 있어
     * 메모리에서 변경해도 {@link #commitAll(CartChangeSet)} 전에는 저장되지 않는다.
     */
    Optional<CustomerShoppingCart> findCart(UUID customerId);

    /**
     * 쌓인 명령을 하나의 트랜잭션으로 반영하고 영향받은 행 수를 반환한다.
     *
     * @throws ConcurrentCartModificationException 조회 이후 다른 요청이 같은 장바구니를 먼저 커밋한 경우
     */
    int commitAll(CartChangeSet changes);
}

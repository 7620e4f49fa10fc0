package com.devstore.domain.cart.service;

import com.devstore.domain.cart.entity.CartItem;
import com.devstore.domain.cart.entity.CustomerShoppingCart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 한 요청에서 커밋할 저장 명령 목록.
 *
 * 오케스트레이터가 변경 단계의 분기(신규 항목 / 기존 항목 수량 갱신 / 삭제)에 따라 명령을 직접 쌓는다.
 * ORM 변경 감지에 의존하지 않으며, {@link CartPersistenceGateway#commitAll(CartChangeSet)}가 한 트랜잭션으로 반영한다.
 */
public final class CartChangeSet {

    public enum Kind { UPSERT_CART, UPSERT_ITEM, DELETE_ITEM }

    public record Change(Kind kind, CustomerShoppingCart cart, CartItem item) {
    }

    private final List<Change> changes = new ArrayList<>();

    public CartChangeSet upsertCart(CustomerShoppingCart cart) {
        changes.add(new Change(Kind.UPSERT_CART, cart, null));
        return this;
    }

    public CartChangeSet upsertItem(CartItem item) {
        changes.add(new Change(Kind.UPSERT_ITEM, null, item));
        return this;
    }

    public CartChangeSet deleteItem(CartItem item) {
        changes.add(new Change(Kind.DELETE_ITEM, null, item));
        return this;
    }

    public List<Change> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}

package com.devstore.domain.cart.repository;

import com.devstore.domain.cart.entity.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface CartItemRepository extends JpaRepository<CartItem, UUID> {

    List<CartItem> findByShoppingCartIdOrderByAddedAtAsc(UUID shoppingCartId);

    /**
     * 장바구니 소속까지 함께 확인하여 삭제한다. 삭제된 행 수를 반환한다.
     */
    @Modifying
    @Query("DELETE FROM CartItem i WHERE i.id = :itemId AND i.shoppingCartId = :shoppingCartId")
    int deleteByIdAndShoppingCartId(@Param("itemId") UUID itemId, @Param("shoppingCartId") UUID shoppingCartId);
}

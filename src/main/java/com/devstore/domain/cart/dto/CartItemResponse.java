package com.devstore.domain.cart.dto;

import com.devstore.domain.cart.entity.CartItem;

import java.math.BigDecimal;
import java.util.UUID;

public record CartItemResponse(
        UUID id,
        UUID productId,
        String name,
        String image,
        BigDecimal price,
        int quantity,
        BigDecimal subtotal
) {
    public static CartItemResponse from(CartItem item) {
        return new CartItemResponse(
                item.getId(),
                item.getProductId(),
                item.getName(),
                item.getImage(),
                item.getPrice(),
                item.getQuantity(),
                item.calculateSubtotal()
        );
    }
}

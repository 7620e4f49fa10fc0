package com.devstore.domain.cart.service;

import com.devstore.domain.cart.exception.CartErrorType;

public record CartError(CartErrorType type, String message) {
}

package com.devstore.domain.cart.repository;

import com.devstore.domain.cart.entity.CustomerShoppingCart;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CustomerShoppingCartRepository extends JpaRepository<CustomerShoppingCart, UUID> {

    Optional<CustomerShoppingCart> findByCustomerId(UUID customerId);
}

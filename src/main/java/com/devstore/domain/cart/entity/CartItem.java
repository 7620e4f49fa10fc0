package com.devstore.domain.cart.entity;

import com.devstore.global.common.ColumnLimits;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "cart_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_cart_item_cart_product",
                columnNames = {"shopping_cart_id", "product_id"}))
public class CartItem {

    @Id
    @Column(name = "cart_item_id", nullable = false, updatable = false)
    private UUID id;

    /**
     * 소유 장바구니 ID. 연관관계 매핑 없이 값으로만 보관한다.
     * 항목의 저장/삭제는 영속성 게이트웨이에 명시적으로 요청한다.
     */
    @Column(name = "shopping_cart_id", nullable = false)
    private UUID shoppingCartId;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    // 담는 시점의 상품 정보 스냅샷
    @Column(name = "product_name", nullable = false, length = 200)
    private String name;

    @Column(name = "image", length = 500)
    private String image;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    protected CartItem() {}

    public CartItem(UUID productId, String name, String image, BigDecimal price, int quantity) {
        this.id = UUID.randomUUID();
        this.productId = productId;
        this.name = name;
        this.image = image;
        this.price = price;
        this.quantity = quantity;
    }

    /**
     * 장바구니에 담기는 시점. addedAt은 여기서 한 번만 기록된다.
     */
    void attachTo(UUID shoppingCartId, LocalDateTime now) {
        this.shoppingCartId = shoppingCartId;
        this.addedAt = now;
        this.updatedAt = now;
    }

    void addUnits(int units, LocalDateTime now) {
        this.quantity = this.quantity + units;
        this.updatedAt = now;
    }

    void updateQuantity(int quantity, LocalDateTime now) {
        this.quantity = quantity;
        this.updatedAt = now;
    }

    public BigDecimal calculateSubtotal() {
        if (price == null || quantity == null) {
            return BigDecimal.ZERO;
        }
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isSameProduct(CartItem other) {
        return other != null && productId != null && productId.equals(other.productId);
    }

    /**
     * 항목 단위 규칙 검사. 위반한 규칙마다 메시지 하나를 돌려준다.
     */
    List<String> collectViolations() {
        List<String> violations = new ArrayList<>();
        String label = name == null || name.isBlank() || ColumnLimits.exceedsLength(name, ColumnLimits.PRODUCT_NAME_LENGTH)
                ? String.valueOf(productId) : name;

        if (productId == null) {
            violations.add("상품 ID가 올바르지 않습니다.");
        }
        if (name == null || name.isBlank()) {
            violations.add("상품명이 입력되지 않았습니다.");
        } else if (ColumnLimits.exceedsLength(name, ColumnLimits.PRODUCT_NAME_LENGTH)) {
            violations.add("상품명은 " + ColumnLimits.PRODUCT_NAME_LENGTH + "자 이하여야 합니다.");
        }
        if (ColumnLimits.exceedsLength(image, ColumnLimits.IMAGE_LENGTH)) {
            violations.add(label + "의 이미지 경로는 " + ColumnLimits.IMAGE_LENGTH + "자 이하여야 합니다.");
        }
        if (quantity == null || quantity < CustomerShoppingCart.MIN_ITEM_QUANTITY) {
            violations.add(label + "의 최소 수량은 " + CustomerShoppingCart.MIN_ITEM_QUANTITY + "개입니다.");
        } else if (quantity > CustomerShoppingCart.MAX_ITEM_QUANTITY) {
            violations.add(label + "의 최대 수량은 " + CustomerShoppingCart.MAX_ITEM_QUANTITY + "개입니다.");
        }
        if (price == null || price.signum() <= 0) {
            violations.add(label + "의 가격은 0보다 커야 합니다.");
        } else if (!ColumnLimits.fitsMoney(price)) {
            violations.add(label + "의 가격은 정수 " + ColumnLimits.MONEY_INTEGER_DIGITS
                    + "자리, 소수 " + ColumnLimits.FRACTION_DIGITS + "자리 이내여야 합니다.");
        }
        return violations;
    }

    public UUID getId() { return id; }
    public UUID getShoppingCartId() { return shoppingCartId; }
    public UUID getProductId() { return productId; }
    public String getName() { return name; }
    public String getImage() { return image; }
    public BigDecimal getPrice() { return price; }
    public Integer getQuantity() { return quantity; }
    public LocalDateTime getAddedAt() { return addedAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}

package com.devstore.domain.cart.entity;

import com.devstore.domain.cart.exception.CartErrorType;
import com.devstore.domain.cart.exception.CartRuleViolationException;
import com.devstore.domain.voucher.entity.Voucher;
import com.devstore.domain.voucher.service.VoucherEligibility;
import com.devstore.domain.voucher.service.VoucherPolicy;
import com.devstore.global.common.ColumnLimits;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 고객 장바구니 집계 루트.
 *
 * amount, discount는 항목/바우처로부터 파생되는 값이며 구조 변경(추가, 수량 변경, 삭제, 바우처 적용) 직후
 * 항상 재계산된다. 변경 연산은 메모리 상태만 바꾸고, 저장은 오케스트레이터가 게이트웨이에 명시적으로 요청한다.
 *
 * 항목 목록은 ORM 연관관계로 관리하지 않는다. 게이트웨이가 조회 시 {@link #loadItems(List)}로 채운다.
 */
@Entity
@Table(name = "customer_shopping_carts",
        uniqueConstraints = @UniqueConstraint(name = "uk_shopping_cart_customer", columnNames = "customer_id"))
public class CustomerShoppingCart {

    public static final int MIN_ITEM_QUANTITY = 1;
    public static final int MAX_ITEM_QUANTITY = 15;

    @Id
    @Column(name = "shopping_cart_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "discount", nullable = false, precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(name = "has_voucher", nullable = false)
    private Boolean hasVoucher;

    @Embedded
    private AppliedVoucher voucher;

    /**
     * 낙관적 락 버전. 조회 이후 다른 요청이 먼저 커밋했다면 저장 시 충돌로 거부된다.
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Transient
    private List<CartItem> items = new ArrayList<>();

    /**
     * 시각 기록용. 조회로 복원된 장바구니는 {@link #useClock(Clock)}로 다시 지정받는다.
     */
    @Transient
    private Clock clock = Clock.systemDefaultZone();

    protected CustomerShoppingCart() {}

    public CustomerShoppingCart(UUID customerId) {
        this(customerId, Clock.systemDefaultZone());
    }

    public CustomerShoppingCart(UUID customerId, Clock clock) {
        this.clock = clock;
        this.id = UUID.randomUUID();
        this.customerId = customerId;
        this.amount = BigDecimal.ZERO;
        this.discount = BigDecimal.ZERO;
        this.hasVoucher = false;
        this.createdAt = LocalDateTime.now(clock);
        this.updatedAt = this.createdAt;
    }

    public void useClock(Clock clock) {
        this.clock = clock;
    }

    public void loadItems(List<CartItem> storedItems) {
        this.items = new ArrayList<>(storedItems);
    }

    /**
     * 항목 추가. 같은 상품이 이미 있으면 수량을 합산한다.
     * 합산 결과가 [1, 15]를 벗어나면 상태를 바꾸지 않고 거부한다.
     */
    public void addItem(CartItem item) {
        Optional<CartItem> existing = getProductById(item.getProductId());
        int requested = item.getQuantity() == null ? 0 : item.getQuantity();
        int resulting = existing.map(stored -> stored.getQuantity() + requested).orElse(requested);

        if (requested < MIN_ITEM_QUANTITY) {
            throw quantityViolation(item.getName(), requested);
        }
        if (resulting > MAX_ITEM_QUANTITY) {
            throw quantityViolation(item.getName(), resulting);
        }

        if (existing.isPresent()) {
            existing.get().addUnits(requested, LocalDateTime.now(clock));
        } else {
            item.attachTo(id, LocalDateTime.now(clock));
            items.add(item);
        }
        recalculate();
    }

    /**
     * 장바구니에 담긴 항목의 수량을 교체한다.
     */
    public void updateUnit(CartItem item, int quantity) {
        requirePresent(item);
        if (quantity < MIN_ITEM_QUANTITY || quantity > MAX_ITEM_QUANTITY) {
            throw quantityViolation(item.getName(), quantity);
        }
        item.updateQuantity(quantity, LocalDateTime.now(clock));
        recalculate();
    }

    /**
     * 항목 삭제. 마지막 항목을 지워도 장바구니 자체는 남는다.
     */
    public void removeItem(CartItem item) {
        requirePresent(item);
        items.remove(item);
        recalculate();
    }

    public boolean hasItem(CartItem candidate) {
        return items.stream().anyMatch(stored -> stored.isSameProduct(candidate));
    }

    public Optional<CartItem> getProductById(UUID productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return items.stream()
                .filter(stored -> productId.equals(stored.getProductId()))
                .findFirst();
    }

    /**
     * 바우처 적용. 적용 가능 여부와 할인 금액은 {@link VoucherPolicy}가 결정한다.
     * 적용 불가면 voucher, discount, hasVoucher를 그대로 두고 거부한다.
     *
     * @param alreadyRedeemed 고객의 해당 코드 사용 이력 (외부 조회 결과)
     */
    public void applyVoucher(Voucher voucher, VoucherPolicy voucherPolicy, boolean alreadyRedeemed) {
        VoucherEligibility eligibility = voucherPolicy.evaluate(voucher, alreadyRedeemed);
        if (!eligibility.isEligible()) {
            throw new CartRuleViolationException(CartErrorType.VOUCHER_INELIGIBLE, eligibility.reasons());
        }
        this.voucher = AppliedVoucher.copyOf(voucher);
        this.hasVoucher = true;
        recalculate();
    }

    /**
     * 전체 규칙 검사. 위반한 규칙마다 메시지 하나를 담아 돌려준다.
     */
    public CartValidationResult validate() {
        List<String> violations = new ArrayList<>();

        if (customerId == null) {
            violations.add("고객 정보를 확인할 수 없습니다.");
        }
        for (CartItem item : items) {
            violations.addAll(item.collectViolations());
        }
        if (amount.signum() < 0) {
            violations.add("장바구니 금액은 0 이상이어야 합니다.");
        }
        if (!ColumnLimits.fitsMoney(amount)) {
            violations.add("장바구니 금액이 저장 가능한 범위를 초과했습니다.");
        }
        if (amount.compareTo(sumOfSubtotals()) != 0) {
            violations.add("장바구니 금액이 항목 합계와 일치하지 않습니다.");
        }
        if (discount.compareTo(amount) > 0) {
            violations.add("할인 금액은 장바구니 금액을 초과할 수 없습니다.");
        }

        return new CartValidationResult(violations);
    }

    public boolean isValid() {
        return validate().valid();
    }

    private void recalculate() {
        this.amount = sumOfSubtotals();
        this.discount = voucher == null
                ? BigDecimal.ZERO
                : VoucherPolicy.computeDiscount(amount, voucher.getDiscountType(),
                        voucher.getPercentage(), voucher.getValue());
        this.updatedAt = LocalDateTime.now(clock);
    }

    private BigDecimal sumOfSubtotals() {
        return items.stream()
                .map(CartItem::calculateSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void requirePresent(CartItem item) {
        if (item == null || items.stream().noneMatch(stored -> stored == item)) {
            throw new CartRuleViolationException(CartErrorType.NOT_FOUND, "장바구니에 없는 상품입니다.");
        }
    }

    private CartRuleViolationException quantityViolation(String productName, int quantity) {
        return new CartRuleViolationException(CartErrorType.VALIDATION,
                productName + "의 수량은 " + MIN_ITEM_QUANTITY + "개 이상 " + MAX_ITEM_QUANTITY
                        + "개 이하여야 합니다. (요청: " + quantity + ")");
    }

    public UUID getId() { return id; }
    public UUID getCustomerId() { return customerId; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getDiscount() { return discount; }
    public boolean hasVoucher() { return Boolean.TRUE.equals(hasVoucher); }
    public AppliedVoucher getVoucher() { return voucher; }
    public Long getVersion() { return version; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public List<CartItem> getItems() { return Collections.unmodifiableList(items); }
}

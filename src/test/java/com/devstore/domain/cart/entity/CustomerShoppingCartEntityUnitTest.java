package com.devstore.domain.cart.entity;

import com.devstore.domain.cart.exception.CartErrorType;
import com.devstore.domain.cart.exception.CartRuleViolationException;
import com.devstore.domain.voucher.entity.DiscountType;
import com.devstore.domain.voucher.entity.Voucher;
import com.devstore.domain.voucher.service.VoucherPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * CustomerShoppingCart 엔티티 단위 테스트 — 수량 범위, 병합, 금액 재계산, 바우처 적용
 */
class CustomerShoppingCartEntityUnitTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZONE);

    private VoucherPolicy voucherPolicy;
    private CustomerShoppingCart cart;

    @BeforeEach
    void setUp() {
        voucherPolicy = new VoucherPolicy(FIXED_CLOCK);
        cart = new CustomerShoppingCart(UUID.randomUUID());
    }

    private CartItem item(UUID productId, String price, int quantity) {
        return new CartItem(productId, "키보드", null, new BigDecimal(price), quantity);
    }

    private Voucher voucher(DiscountType type, String percentage, String value, LocalDateTime expirationDate) {
        return new Voucher("WELCOME", type,
                percentage == null ? null : new BigDecimal(percentage),
                value == null ? null : new BigDecimal(value),
                expirationDate, true, false);
    }

    private LocalDateTime future() {
        return LocalDateTime.now(FIXED_CLOCK).plusDays(7);
    }

    @Test
    @DisplayName("생성자 — 초기값: 항목 없음, amount/discount 0, 바우처 없음")
    void constructor_setsDefaults() {
        assertThat(cart.getId()).isNotNull();
        assertThat(cart.getItems()).isEmpty();
        assertThat(cart.getAmount()).isEqualByComparingTo("0");
        assertThat(cart.getDiscount()).isEqualByComparingTo("0");
        assertThat(cart.hasVoucher()).isFalse();
        assertThat(cart.getVoucher()).isNull();
        assertThat(cart.isValid()).isTrue();
    }

    @Test
    @DisplayName("addItem — 같은 상품 2개 + 3개 추가 시 단일 항목 수량 5로 병합")
    void addItem_sameProduct_mergesQuantity() {
        UUID productId = UUID.randomUUID();

        cart.addItem(item(productId, "10.00", 2));
        cart.addItem(item(productId, "10.00", 3));

        assertThat(cart.getItems()).hasSize(1);
        assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(5);
        assertThat(cart.getAmount()).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("addItem — 병합 결과는 한 번에 5개 추가한 것과 같다")
    void addItem_mergeEquivalentToSingleAdd() {
        UUID productId = UUID.randomUUID();
        CustomerShoppingCart other = new CustomerShoppingCart(UUID.randomUUID());

        cart.addItem(item(productId, "10.00", 2));
        cart.addItem(item(productId, "10.00", 3));
        other.addItem(item(productId, "10.00", 5));

        assertThat(cart.getItems()).hasSize(other.getItems().size());
        assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(other.getItems().get(0).getQuantity());
        assertThat(cart.getAmount()).isEqualByComparingTo(other.getAmount());
    }

    @Test
    @DisplayName("addItem — 새 항목은 장바구니 ID를 소유 장바구니로 가진다")
    void addItem_attachesItemToCart() {
        CartItem added = item(UUID.randomUUID(), "10.00", 1);

        cart.addItem(added);

        assertThat(added.getShoppingCartId()).isEqualTo(cart.getId());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 16, -1})
    @DisplayName("addItem — 수량이 [1, 15] 밖이면 VALIDATION으로 거부되고 상태는 그대로")
    void addItem_quantityOutOfRange_rejectedWithoutStateChange(int quantity) {
        assertThatThrownBy(() -> cart.addItem(item(UUID.randomUUID(), "10.00", quantity)))
                .isInstanceOf(CartRuleViolationException.class)
                .extracting(e -> ((CartRuleViolationException) e).getErrorType())
                .isEqualTo(CartErrorType.VALIDATION);

        assertThat(cart.getItems()).isEmpty();
        assertThat(cart.getAmount()).isEqualByComparingTo("0");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 15})
    @DisplayName("addItem — 경계값 1, 15는 허용")
    void addItem_boundaryQuantities_accepted(int quantity) {
        cart.addItem(item(UUID.randomUUID(), "10.00", quantity));

        assertThat(cart.getItems()).hasSize(1);
        assertThat(cart.isValid()).isTrue();
    }

    @Test
    @DisplayName("addItem — 병합 결과가 15를 넘으면 거부되고 기존 수량 유지")
    void addItem_mergeExceedingMax_rejected() {
        UUID productId = UUID.randomUUID();
        cart.addItem(item(productId, "10.00", 10));

        assertThatThrownBy(() -> cart.addItem(item(productId, "10.00", 6)))
                .isInstanceOf(CartRuleViolationException.class);

        assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(10);
        assertThat(cart.getAmount()).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("updateUnit — 수량 교체 후 amount 재계산")
    void updateUnit_recalculatesAmount() {
        UUID productId = UUID.randomUUID();
        cart.addItem(item(productId, "12.50", 2));
        CartItem stored = cart.getProductById(productId).orElseThrow();

        cart.updateUnit(stored, 4);

        assertThat(stored.getQuantity()).isEqualTo(4);
        assertThat(cart.getAmount()).isEqualByComparingTo("50.00");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 16})
    @DisplayName("updateUnit — 범위 밖 수량은 거부되고 상태 유지")
    void updateUnit_outOfRange_rejected(int quantity) {
        UUID productId = UUID.randomUUID();
        cart.addItem(item(productId, "10.00", 3));
        CartItem stored = cart.getProductById(productId).orElseThrow();

        assertThatThrownBy(() -> cart.updateUnit(stored, quantity))
                .isInstanceOf(CartRuleViolationException.class);

        assertThat(stored.getQuantity()).isEqualTo(3);
        assertThat(cart.getAmount()).isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("updateUnit — 장바구니에 없는 항목이면 NOT_FOUND")
    void updateUnit_foreignItem_notFound() {
        CartItem foreign = item(UUID.randomUUID(), "10.00", 1);

        assertThatThrownBy(() -> cart.updateUnit(foreign, 2))
                .isInstanceOf(CartRuleViolationException.class)
                .extracting(e -> ((CartRuleViolationException) e).getErrorType())
                .isEqualTo(CartErrorType.NOT_FOUND);
    }

    @Test
    @DisplayName("removeItem — 마지막 항목을 지워도 장바구니는 남고 amount는 0")
    void removeItem_lastItem_keepsEmptyCart() {
        UUID productId = UUID.randomUUID();
        cart.addItem(item(productId, "10.00", 2));

        cart.removeItem(cart.getProductById(productId).orElseThrow());

        assertThat(cart.getItems()).isEmpty();
        assertThat(cart.getAmount()).isEqualByComparingTo("0");
        assertThat(cart.isValid()).isTrue();
    }

    @Test
    @DisplayName("여러 변경 후에도 amount는 항상 항목 소계 합과 같다")
    void amountInvariant_holdsAfterEveryMutation() {
        UUID keyboard = UUID.randomUUID();
        UUID mouse = UUID.randomUUID();

        cart.addItem(item(keyboard, "39.90", 1));
        assertAmountMatchesSubtotals();
        cart.addItem(item(mouse, "15.25", 3));
        assertAmountMatchesSubtotals();
        cart.addItem(item(keyboard, "39.90", 2));
        assertAmountMatchesSubtotals();
        cart.updateUnit(cart.getProductById(mouse).orElseThrow(), 1);
        assertAmountMatchesSubtotals();
        cart.removeItem(cart.getProductById(keyboard).orElseThrow());
        assertAmountMatchesSubtotals();

        assertThat(cart.getAmount()).isEqualByComparingTo("15.25");
    }

    private void assertAmountMatchesSubtotals() {
        BigDecimal expected = cart.getItems().stream()
                .map(CartItem::calculateSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(cart.getAmount()).isEqualByComparingTo(expected);
        assertThat(cart.isValid()).isTrue();
    }

    @Test
    @DisplayName("applyVoucher — 정액 1000 바우처를 amount 50에 적용하면 할인은 50으로 제한")
    void applyVoucher_fixedValue_cappedAtAmount() {
        cart.addItem(item(UUID.randomUUID(), "10.00", 5));

        cart.applyVoucher(voucher(DiscountType.FIXED_VALUE, null, "1000", future()), voucherPolicy, false);

        assertThat(cart.getDiscount()).isEqualByComparingTo("50.00");
        assertThat(cart.hasVoucher()).isTrue();
        assertThat(cart.isValid()).isTrue();
    }

    @Test
    @DisplayName("applyVoucher — amount 200, 정률 10% → 할인 20")
    void applyVoucher_percentage_appliesRate() {
        cart.addItem(item(UUID.randomUUID(), "20.00", 10));

        cart.applyVoucher(voucher(DiscountType.PERCENTAGE, "10", null, future()), voucherPolicy, false);

        assertThat(cart.getAmount()).isEqualByComparingTo("200.00");
        assertThat(cart.getDiscount()).isEqualByComparingTo("20.00");
        assertThat(cart.getVoucher().getCode()).isEqualTo("WELCOME");
    }

    @Test
    @DisplayName("applyVoucher — 만료된 바우처는 거부되고 voucher/discount/hasVoucher 유지")
    void applyVoucher_expired_leavesStateUnchanged() {
        cart.addItem(item(UUID.randomUUID(), "10.00", 5));
        LocalDateTime yesterday = LocalDateTime.now(FIXED_CLOCK).minusDays(1);

        assertThatThrownBy(() -> cart.applyVoucher(
                voucher(DiscountType.PERCENTAGE, "10", null, yesterday), voucherPolicy, false))
                .isInstanceOf(CartRuleViolationException.class)
                .satisfies(e -> {
                    CartRuleViolationException violation = (CartRuleViolationException) e;
                    assertThat(violation.getErrorType()).isEqualTo(CartErrorType.VOUCHER_INELIGIBLE);
                    assertThat(violation.getMessages()).isNotEmpty();
                });

        assertThat(cart.getVoucher()).isNull();
        assertThat(cart.getDiscount()).isEqualByComparingTo("0");
        assertThat(cart.hasVoucher()).isFalse();
    }

    @Test
    @DisplayName("applyVoucher 후 항목 변경 시 할인 금액이 새 amount 기준으로 재계산된다")
    void itemMutationAfterVoucher_recomputesDiscount() {
        UUID productId = UUID.randomUUID();
        cart.addItem(item(productId, "10.00", 5));
        cart.applyVoucher(voucher(DiscountType.FIXED_VALUE, null, "30", future()), voucherPolicy, false);
        assertThat(cart.getDiscount()).isEqualByComparingTo("30.00");

        cart.updateUnit(cart.getProductById(productId).orElseThrow(), 2);

        assertThat(cart.getAmount()).isEqualByComparingTo("20.00");
        assertThat(cart.getDiscount()).isEqualByComparingTo("20.00");
        assertThat(cart.isValid()).isTrue();
    }

    @Test
    @DisplayName("validate — 이름 없음, 가격 0 항목은 위반 메시지를 각각 돌려준다")
    void validate_reportsEveryItemViolation() {
        cart.addItem(new CartItem(UUID.randomUUID(), " ", null, BigDecimal.ZERO, 1));

        CartValidationResult result = cart.validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(2);
    }

    @Test
    @DisplayName("validate — 상품명 200자, 이미지 경로 500자를 넘으면 컬럼 한도 위반")
    void validate_textLongerThanColumn_rejected() {
        cart.addItem(new CartItem(UUID.randomUUID(), "x".repeat(201), "/".repeat(501), new BigDecimal("10.00"), 1));

        CartValidationResult result = cart.validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors()).anyMatch(message -> message.contains("200자"));
        assertThat(result.errors()).anyMatch(message -> message.contains("500자"));
    }

    @Test
    @DisplayName("validate — 상품명 200자는 허용")
    void validate_nameAtColumnLimit_valid() {
        cart.addItem(new CartItem(UUID.randomUUID(), "x".repeat(200), null, new BigDecimal("10.00"), 1));

        assertThat(cart.isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0.001", "10.005", "12345678901.00"})
    @DisplayName("validate — 소수 셋째 자리 이하 또는 정수 10자리를 넘는 가격은 반올림 없이 거부")
    void validate_priceNotStorableWithoutRounding_rejected(String price) {
        cart.addItem(item(UUID.randomUUID(), price, 1));

        CartValidationResult result = cart.validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).anyMatch(message -> message.contains("소수 2자리"));
    }

    @Test
    @DisplayName("validate — 소수 둘째 자리까지의 가격과 뒤쪽 0은 허용")
    void validate_priceWithTwoFractionDigits_valid() {
        cart.addItem(item(UUID.randomUUID(), "12.34", 1));
        cart.addItem(item(UUID.randomUUID(), "5.5000", 1));

        assertThat(cart.isValid()).isTrue();
        assertThat(cart.getAmount()).isEqualByComparingTo("17.84");
    }

    @Test
    @DisplayName("시각 기록 — 생성, 추가, 수량 변경 시각은 주입된 Clock을 따른다")
    void timestamps_followInjectedClock() {
        LocalDateTime created = LocalDateTime.now(FIXED_CLOCK);
        CustomerShoppingCart clocked = new CustomerShoppingCart(UUID.randomUUID(), FIXED_CLOCK);
        UUID productId = UUID.randomUUID();

        clocked.addItem(item(productId, "10", 1));

        CartItem stored = clocked.getProductById(productId).orElseThrow();
        assertThat(clocked.getCreatedAt()).isEqualTo(created);
        assertThat(clocked.getUpdatedAt()).isEqualTo(created);
        assertThat(stored.getAddedAt()).isEqualTo(created);
        assertThat(stored.getUpdatedAt()).isEqualTo(created);

        Clock later = Clock.offset(FIXED_CLOCK, Duration.ofMinutes(5));
        clocked.useClock(later);
        clocked.updateUnit(stored, 3);

        assertThat(stored.getAddedAt()).isEqualTo(created);
        assertThat(stored.getUpdatedAt()).isEqualTo(LocalDateTime.now(later));
        assertThat(clocked.getUpdatedAt()).isEqualTo(LocalDateTime.now(later));
        assertThat(clocked.getCreatedAt()).isEqualTo(created);
    }
}

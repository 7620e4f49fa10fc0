package com.devstore.domain.cart.service;

import com.devstore.domain.cart.dto.CartItemRequest;
import com.devstore.domain.cart.dto.CartItemResponse;
import com.devstore.domain.cart.dto.CartResponse;
import com.devstore.domain.cart.dto.VoucherRequest;
import com.devstore.domain.cart.entity.CartItem;
import com.devstore.domain.cart.entity.CartValidationResult;
import com.devstore.domain.cart.entity.CustomerShoppingCart;
import com.devstore.domain.cart.exception.CartErrorType;
import com.devstore.domain.cart.exception.CartRuleViolationException;
import com.devstore.domain.cart.exception.CartStorageRejectedException;
import com.devstore.domain.cart.exception.ConcurrentCartModificationException;
import com.devstore.domain.voucher.entity.Voucher;
import com.devstore.domain.voucher.service.VoucherPolicy;
import com.devstore.domain.voucher.service.VoucherRedemptionHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * 장바구니 변경 요청 오케스트레이터.
 *
 * 모든 변경 연산은 같은 단계를 따른다.
 *   장바구니 조회 → 대상 항목 바인딩(수정/삭제) → 집계 변경 → 집계 검증 → 저장 → 응답
 *
 * 오류는 요청마다 새로 만든 {@link ErrorAccumulator}에 모은다. 누적된 오류가 하나라도 있으면
 * 저장 단계에 진입하지 않으므로 일부만 반영되는 쓰기는 발생하지 않는다.
 * 재시도 루프는 없다. 실패는 전부 호출자에게 돌려주어 다시 요청하게 한다.
 *
 * 트랜잭션 경계는 게이트웨이가 가진다 (조회 1회, 커밋 1회).
 */
@Service
public class ShoppingCartService {

    private static final Logger log = LoggerFactory.getLogger(ShoppingCartService.class);

    static final String CART_NOT_FOUND = "장바구니를 찾을 수 없습니다.";
    static final String ITEM_NOT_IN_CART = "장바구니에 없는 상품입니다.";
    static final String ITEM_IDENTITY_MISMATCH = "요청 경로의 상품과 본문의 상품이 일치하지 않습니다.";
    static final String PERSISTENCE_FAILED = "데이터 저장 중 오류가 발생했습니다.";

    private final CartPersistenceGateway cartGateway;
    private final VoucherPolicy voucherPolicy;
    private final VoucherRedemptionHistory redemptionHistory;
    private final Clock clock;

    public ShoppingCartService(CartPersistenceGateway cartGateway,
                               VoucherPolicy voucherPolicy,
                               VoucherRedemptionHistory redemptionHistory,
                               Clock clock) {
        this.cartGateway = cartGateway;
        this.voucherPolicy = voucherPolicy;
        this.redemptionHistory = redemptionHistory;
        this.clock = clock;
    }

    /**
     * 장바구니 조회. 아직 없으면 저장하지 않은 빈 장바구니를 돌려준다.
     */
    public CartResponse getCart(UUID customerId) {
        CustomerShoppingCart cart = findCart(customerId)
                .orElseGet(() -> new CustomerShoppingCart(customerId, clock));
        return CartResponse.from(cart);
    }

    /**
     * 항목 추가. 장바구니가 없으면 메모리에서 새로 만든다.
     * 같은 상품이 이미 있으면 수량을 합산하고, 저장 명령은 "기존 항목 갱신"으로 낸다.
     */
    public CartOperationResult<CartItemResponse> addItem(UUID customerId, CartItemRequest request) {
        ErrorAccumulator errors = new ErrorAccumulator();

        CustomerShoppingCart cart = findCart(customerId)
                .orElseGet(() -> new CustomerShoppingCart(customerId, clock));

        CartItem incoming = request.toEntity();
        boolean mergeIntoExisting = cart.hasItem(incoming);
        mutate(errors, () -> cart.addItem(incoming));
        validate(cart, errors);

        if (errors.hasErrors()) {
            return reject("addItem", customerId, errors);
        }

        CartItem stored = mergeIntoExisting
                ? cart.getProductById(incoming.getProductId()).orElseThrow()
                : incoming;

        persist(new CartChangeSet()
                .upsertCart(cart)
                .upsertItem(stored), errors);

        if (errors.hasErrors()) {
            return reject("addItem", customerId, errors);
        }
        log.debug("Cart item added. customerId={}, productId={}, quantity={}, merged={}",
                customerId, stored.getProductId(), stored.getQuantity(), mergeIntoExisting);
        return CartOperationResult.success(CartItemResponse.from(stored));
    }

    /**
     * 수량 변경. 경로의 productId와 본문의 productId가 같아야 하며 항목이 장바구니에 있어야 한다.
     */
    public CartOperationResult<Void> updateItem(UUID customerId, UUID productId, CartItemRequest request) {
        ErrorAccumulator errors = new ErrorAccumulator();

        Optional<CustomerShoppingCart> resolved = resolveCart(customerId, errors);
        if (!productId.equals(request.productId())) {
            errors.add(CartErrorType.IDENTITY_MISMATCH, ITEM_IDENTITY_MISMATCH);
        }
        Optional<CartItem> target = bindTarget(resolved, productId, errors);
        if (errors.hasErrors()) {
            return reject("updateItem", customerId, errors);
        }

        CustomerShoppingCart cart = resolved.get();
        CartItem item = target.get();
        mutate(errors, () -> cart.updateUnit(item, request.quantity()));
        validate(cart, errors);

        if (errors.hasErrors()) {
            return reject("updateItem", customerId, errors);
        }

        persist(new CartChangeSet()
                .upsertCart(cart)
                .upsertItem(item), errors);

        return errors.hasErrors() ? reject("updateItem", customerId, errors) : CartOperationResult.success(null);
    }

    /**
     * 항목 삭제. 마지막 항목을 지워도 장바구니는 남는다.
     */
    public CartOperationResult<Void> removeItem(UUID customerId, UUID productId) {
        ErrorAccumulator errors = new ErrorAccumulator();

        Optional<CustomerShoppingCart> resolved = resolveCart(customerId, errors);
        Optional<CartItem> target = bindTarget(resolved, productId, errors);
        if (errors.hasErrors()) {
            return reject("removeItem", customerId, errors);
        }

        CustomerShoppingCart cart = resolved.get();
        CartItem item = target.get();
        mutate(errors, () -> cart.removeItem(item));
        validate(cart, errors);

        if (errors.hasErrors()) {
            return reject("removeItem", customerId, errors);
        }

        persist(new CartChangeSet()
                .upsertCart(cart)
                .deleteItem(item), errors);

        return errors.hasErrors() ? reject("removeItem", customerId, errors) : CartOperationResult.success(null);
    }

    /**
     * 바우처 적용. firstTimeUseOnly 바우처만 사용 이력을 조회한다.
     */
    public CartOperationResult<Void> applyVoucher(UUID customerId, VoucherRequest request) {
        ErrorAccumulator errors = new ErrorAccumulator();

        Optional<CustomerShoppingCart> resolved = resolveCart(customerId, errors);
        if (errors.hasErrors()) {
            return reject("applyVoucher", customerId, errors);
        }

        CustomerShoppingCart cart = resolved.get();
        Voucher voucher = request.toVoucher();
        boolean alreadyRedeemed = voucher.firstTimeUseOnly()
                && redemptionHistory.hasRedeemed(customerId, voucher.code());
        mutate(errors, () -> cart.applyVoucher(voucher, voucherPolicy, alreadyRedeemed));
        validate(cart, errors);

        if (errors.hasErrors()) {
            return reject("applyVoucher", customerId, errors);
        }

        persist(new CartChangeSet().upsertCart(cart), errors);

        return errors.hasErrors() ? reject("applyVoucher", customerId, errors) : CartOperationResult.success(null);
    }

    private Optional<CustomerShoppingCart> findCart(UUID customerId) {
        Optional<CustomerShoppingCart> cart = cartGateway.findCart(customerId);
        cart.ifPresent(found -> found.useClock(clock));
        return cart;
    }

    private Optional<CustomerShoppingCart> resolveCart(UUID customerId, ErrorAccumulator errors) {
        Optional<CustomerShoppingCart> cart = findCart(customerId);
        if (cart.isEmpty()) {
            errors.add(CartErrorType.NOT_FOUND, CART_NOT_FOUND);
        }
        return cart;
    }

    private Optional<CartItem> bindTarget(Optional<CustomerShoppingCart> cart, UUID productId,
                                          ErrorAccumulator errors) {
        if (cart.isEmpty()) {
            return Optional.empty();
        }
        Optional<CartItem> item = cart.get().getProductById(productId);
        if (item.isEmpty()) {
            errors.add(CartErrorType.NOT_FOUND, ITEM_NOT_IN_CART);
        }
        return item;
    }

    private void mutate(ErrorAccumulator errors, Runnable mutation) {
        try {
            mutation.run();
        } catch (CartRuleViolationException e) {
            errors.addAll(e.getErrorType(), e.getMessages());
        }
    }

    private void validate(CustomerShoppingCart cart, ErrorAccumulator errors) {
        CartValidationResult result = cart.validate();
        if (!result.valid()) {
            errors.addAll(CartErrorType.VALIDATION, result.errors());
        }
    }

    /**
     * 오류가 없을 때만 호출된다. 커밋이 반영한 행이 없으면 검증을 통과했더라도 저장 실패로 기록한다.
     */
    private void persist(CartChangeSet changes, ErrorAccumulator errors) {
        try {
            int affected = cartGateway.commitAll(changes);
            if (affected <= 0) {
                errors.add(CartErrorType.PERSISTENCE_FAILURE, PERSISTENCE_FAILED);
                return;
            }
            log.debug("Cart changes committed. commands={}, affected={}", changes.getChanges().size(), affected);
        } catch (ConcurrentCartModificationException e) {
            errors.add(CartErrorType.CONCURRENT_MODIFICATION, e.getMessage());
        } catch (CartStorageRejectedException e) {
            errors.add(CartErrorType.VALIDATION, e.getMessage());
        }
    }

    private <T> CartOperationResult<T> reject(String operation, UUID customerId, ErrorAccumulator errors) {
        log.warn("Cart {} rejected. customerId={}, errors={}", operation, customerId, errors.getMessages());
        return CartOperationResult.failure(errors);
    }
}

package com.devstore.domain.cart.repository;

import com.devstore.domain.cart.entity.CustomerShoppingCart;
import com.devstore.domain.cart.exception.CartStorageRejectedException;
import com.devstore.domain.cart.exception.ConcurrentCartModificationException;
import com.devstore.domain.cart.service.CartChangeSet;
import com.devstore.domain.cart.service.CartPersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA 기반 장바구니 게이트웨이.
 *
 * 조회와 커밋을 각각 독립 트랜잭션으로 실행한다. open-in-view를 끈 상태에서 조회 트랜잭션이 끝나면
 * 엔티티는 분리(detached)되므로, 검증 실패로 커밋하지 않은 변경이 flush되는 일이 없다.
 *
 * 동시성: 장바구니 행의 @Version으로 read-modify-write 충돌을 감지한다.
 * 같은 고객의 첫 장바구니를 두 요청이 동시에 만들면 UNIQUE(customer_id) 위반으로 감지된다.
 * 행 잠금 대기 시간 초과도 같은 충돌로 취급한다.
 * 그 밖의 무결성 위반(컬럼 길이, 숫자 범위 등)은 충돌이 아니므로 {@link CartStorageRejectedException}으로 구분한다.
 */
@Component
public class JpaCartPersistenceGateway implements CartPersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaCartPersistenceGateway.class);

    private static final List<String> UNIQUE_CONSTRAINTS =
            List.of("uk_shopping_cart_customer", "uk_cart_item_cart_product");

    private final CustomerShoppingCartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final TransactionTemplate readTransaction;
    private final TransactionTemplate writeTransaction;

    public JpaCartPersistenceGateway(CustomerShoppingCartRepository cartRepository,
                                     CartItemRepository cartItemRepository,
                                     PlatformTransactionManager transactionManager) {
        this.cartRepository = cartRepository;
        this.cartItemRepository = cartItemRepository;
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.writeTransaction = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<CustomerShoppingCart> findCart(UUID customerId) {
        return readTransaction.execute(status -> cartRepository.findByCustomerId(customerId)
                .map(cart -> {
                    cart.loadItems(cartItemRepository.findByShoppingCartIdOrderByAddedAtAsc(cart.getId()));
                    return cart;
                }));
    }

    @Override
    public int commitAll(CartChangeSet changes) {
        try {
            Integer affected = writeTransaction.execute(status -> {
                int count = 0;
                for (CartChangeSet.Change change : changes.getChanges()) {
                    switch (change.kind()) {
                        case UPSERT_CART -> {
                            cartRepository.save(change.cart());
                            count++;
                        }
                        case UPSERT_ITEM -> {
                            cartItemRepository.save(change.item());
                            count++;
                        }
                        case DELETE_ITEM -> count += cartItemRepository.deleteByIdAndShoppingCartId(
                                change.item().getId(), change.item().getShoppingCartId());
                    }
                }
                return count;
            });
            return affected == null ? 0 : affected;
        } catch (ConcurrencyFailureException e) {
            log.warn("Cart commit rejected by concurrent modification: {}", e.getMessage());
            throw new ConcurrentCartModificationException(e);
        } catch (DataIntegrityViolationException e) {
            if (isUniqueConflict(e)) {
                log.warn("Cart commit rejected by unique constraint race: {}", e.getMessage());
                throw new ConcurrentCartModificationException(e);
            }
            log.warn("Cart commit rejected by storage constraint: {}", e.getMessage());
            throw new CartStorageRejectedException(e);
        }
    }

    /**
     * 예외 체인의 메시지에 장바구니/항목 유니크 제약 이름이 있는지 확인한다.
     */
    static boolean isUniqueConflict(DataIntegrityViolationException exception) {
        String raw = buildSearchableMessage(exception).toLowerCase(Locale.ROOT);
        return UNIQUE_CONSTRAINTS.stream().anyMatch(raw::contains);
    }

    private static String buildSearchableMessage(Throwable throwable) {
        StringBuilder builder = new StringBuilder();
        Throwable cursor = throwable;

        while (cursor != null) {
            if (cursor.getMessage() != null) {
                builder.append(cursor.getMessage()).append(' ');
            }
            cursor = cursor.getCause();
        }

        return builder.toString();
    }
}

package com.devstore.domain.cart.controller.api;

import com.devstore.domain.cart.dto.CartItemRequest;
import com.devstore.domain.cart.dto.CartItemResponse;
import com.devstore.domain.cart.dto.CartResponse;
import com.devstore.domain.cart.dto.VoucherRequest;
import com.devstore.domain.cart.exception.CartErrorType;
import com.devstore.domain.cart.service.CartOperationResult;
import com.devstore.domain.cart.service.ShoppingCartService;
import com.devstore.global.dto.ValidationProblem;
import com.devstore.global.security.CustomerIdentity;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * 장바구니 REST API 컨트롤러.
 *
 * 고객 식별자는 {@link CustomerIdentity} 파라미터로만 받는다. 변경 요청의 결과는 서비스가 돌려준
 * {@link CartOperationResult}를 상태 코드로 옮기기만 한다.
 */
@RestController
@RequestMapping("/api/v1/shopping-cart")
public class CartApiController {

    private final ShoppingCartService shoppingCartService;

    public CartApiController(ShoppingCartService shoppingCartService) {
        this.shoppingCartService = shoppingCartService;
    }

    /**
     * 장바구니 조회. 아직 없으면 빈 장바구니를 반환한다.
     */
    @GetMapping
    public CartResponse getCart(CustomerIdentity customer) {
        return shoppingCartService.getCart(customer.customerId());
    }

    /**
     * 장바구니에 상품 추가. 이미 담긴 상품이면 수량이 합산된다.
     */
    @PostMapping
    public ResponseEntity<?> addItem(CustomerIdentity customer, @Valid @RequestBody CartItemRequest request) {
        CartOperationResult<CartItemResponse> result = shoppingCartService.addItem(customer.customerId(), request);
        if (!result.isSuccess()) {
            return failure(result);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result.payload());
    }

    @PutMapping("/{productId}")
    public ResponseEntity<?> updateItem(CustomerIdentity customer,
                                        @PathVariable UUID productId,
                                        @Valid @RequestBody CartItemRequest request) {
        return noContentOrFailure(shoppingCartService.updateItem(customer.customerId(), productId, request));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<?> removeItem(CustomerIdentity customer, @PathVariable UUID productId) {
        return noContentOrFailure(shoppingCartService.removeItem(customer.customerId(), productId));
    }

    @PostMapping("/apply-voucher")
    public ResponseEntity<?> applyVoucher(CustomerIdentity customer, @Valid @RequestBody VoucherRequest request) {
        return noContentOrFailure(shoppingCartService.applyVoucher(customer.customerId(), request));
    }

    private ResponseEntity<?> noContentOrFailure(CartOperationResult<Void> result) {
        if (!result.isSuccess()) {
            return failure(result);
        }
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<ValidationProblem> failure(CartOperationResult<?> result) {
        HttpStatus status = statusOf(result);
        return ResponseEntity.status(status).body(ValidationProblem.of(status, result.messages()));
    }

    /**
     * 동시 수정 충돌이 하나라도 있으면 409, 모든 오류가 "없음"이면 404, 그 외는 400.
     */
    static HttpStatus statusOf(CartOperationResult<?> result) {
        if (result.has(CartErrorType.CONCURRENT_MODIFICATION)) {
            return HttpStatus.CONFLICT;
        }
        if (result.hasOnly(CartErrorType.NOT_FOUND)) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_REQUEST;
    }
}

package com.devstore.global.security;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.AuthenticationUserDetailsService;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * 게이트웨이 헤더로 전달된 고객 식별자를 {@link CustomerPrincipal}로 변환한다.
 */
@Service
public class CustomerDetailsService implements AuthenticationUserDetailsService<PreAuthenticatedAuthenticationToken> {

    static final String ROLE_CUSTOMER = "ROLE_CUSTOMER";

    /**
     * @Cacheable: 같은 고객의 연속 요청에서 식별자 파싱과 권한 생성을 건너뛴다. TTL은 CacheConfig 참고.
     */
    @Override
    @Cacheable(value = "customerPrincipals", key = "#token.name")
    public UserDetails loadUserDetails(PreAuthenticatedAuthenticationToken token) throws UsernameNotFoundException {
        UUID customerId = parseCustomerId(token.getName());
        return new CustomerPrincipal(customerId, List.of(new SimpleGrantedAuthority(ROLE_CUSTOMER)));
    }

    private UUID parseCustomerId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UsernameNotFoundException("고객 식별자가 없습니다.");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new UsernameNotFoundException("유효하지 않은 고객 식별자입니다: " + raw, e);
        }
    }
}

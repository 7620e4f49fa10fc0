package com.devstore.global.config;

import com.devstore.global.security.CustomerDetailsService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.ProviderManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationProvider;
import org.springframework.security.web.authentication.preauth.RequestHeaderAuthenticationFilter;
import org.springframework.security.web.context.RequestAttributeSecurityContextRepository;

/**
 * 고객 인증은 앞단 게이트웨이가 수행하고, 검증된 고객 ID를 헤더로 전달한다.
 * 이 서비스는 헤더를 pre-authenticated 토큰으로 받아 CustomerPrincipal을 만든다.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final CustomerDetailsService customerDetailsService;
    private final String customerHeader;

    public SecurityConfig(CustomerDetailsService customerDetailsService,
                          @Value("${app.security.customer-header:X-Customer-Id}") String customerHeader) {
        this.customerDetailsService = customerDetailsService;
        this.customerHeader = customerHeader;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health").permitAll()  // 로드밸런서 헬스체크용
                .requestMatchers("/error").permitAll()
                .requestMatchers("/api/**").hasRole("CUSTOMER")
                .anyRequest().denyAll()
            )
            .addFilter(customerHeaderFilter())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            // 쿠키 세션을 쓰지 않는 API라 CSRF 토큰이 필요 없다.
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint((request, response, authException) -> {
                    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
                    response.setContentType("application/json;charset=UTF-8");
                    response.getWriter().write(
                            "{\"title\":\"인증이 필요합니다.\",\"status\":401,\"errors\":{\"Messages\":[\"인증이 필요합니다.\"]}}");
                })
            );

        return http.build();
    }

    /**
     * 빈으로 등록하지 않는다. 빈으로 등록하면 서블릿 필터로도 중복 등록된다.
     */
    private RequestHeaderAuthenticationFilter customerHeaderFilter() {
        RequestHeaderAuthenticationFilter filter = new RequestHeaderAuthenticationFilter();
        filter.setPrincipalRequestHeader(customerHeader);
        filter.setExceptionIfHeaderMissing(false);
        filter.setAuthenticationManager(customerAuthenticationManager());
        filter.setSecurityContextRepository(new RequestAttributeSecurityContextRepository());
        return filter;
    }

    private AuthenticationManager customerAuthenticationManager() {
        PreAuthenticatedAuthenticationProvider provider = new PreAuthenticatedAuthenticationProvider();
        provider.setPreAuthenticatedUserDetailsService(customerDetailsService);
        return new ProviderManager(provider);
    }
}

package com.devstore.global.security;

import org.springframework.core.MethodParameter;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 핸들러 실행 전에 SecurityContext에서 고객을 꺼내 {@link CustomerIdentity}로 주입한다.
 * 인증된 고객이 없으면 오케스트레이션 단계에 들어가기 전에 실패한다.
 */
public class CustomerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CustomerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CustomerIdentity resolveArgument(MethodParameter parameter,
                                            ModelAndViewContainer mavContainer,
                                            NativeWebRequest webRequest,
                                            WebDataBinderFactory binderFactory) {
        return SecurityUtil.getCurrentCustomerId()
                .map(CustomerIdentity::new)
                .orElseThrow(() -> new AuthenticationCredentialsNotFoundException("인증된 고객 정보가 없습니다."));
    }
}

package com.devstore.global.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.io.Serializable;
import java.util.Collection;
import java.util.UUID;

/**
 * 게이트웨이가 인증한 고객. 비밀번호는 이 서비스에서 다루지 않는다.
 */
public class CustomerPrincipal implements UserDetails, Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID customerId;
    private final Collection<? extends GrantedAuthority> authorities;

    public CustomerPrincipal(UUID customerId, Collection<? extends GrantedAuthority> authorities) {
        this.customerId = customerId;
        this.authorities = authorities;
    }

    public UUID getCustomerId() { return customerId; }

    @Override public Collection<? extends GrantedAuthority> getAuthorities() { return authorities; }
    @Override public String getPassword() { return ""; }
    @Override public String getUsername() { return customerId.toString(); }
    @Override public boolean isAccountNonExpired() { return true; }
    @Override public boolean isAccountNonLocked() { return true; }
    @Override public boolean isCredentialsNonExpired() { return true; }
    @Override public boolean isEnabled() { return true; }
}

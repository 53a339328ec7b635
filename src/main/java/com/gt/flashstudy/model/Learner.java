package com.gt.flashstudy.model;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

// Authenticated principal placed in the security context by the JWT filter
public class Learner implements UserDetails {

    private final String learnerId;
    private final String username;
    private final String passwordHash;
    private final boolean locked;
    private final boolean enabled;

    public Learner(String learnerId, String username, String passwordHash, boolean locked, boolean enabled) {
        this.learnerId = learnerId;
        this.username = username;
        this.passwordHash = passwordHash;
        this.locked = locked;
        this.enabled = enabled;
    }

    public String getLearnerId() {
        return learnerId;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of();
    }

    @Override
    public String getUsername() {
        return username;
    }

    @Override
    public String getPassword() {
        return passwordHash;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return !locked;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}

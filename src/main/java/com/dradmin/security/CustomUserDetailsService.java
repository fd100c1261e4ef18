package com.dradmin.security;

import java.util.Collections;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

import com.dradmin.entity.AdminUser;
import com.dradmin.repository.IAdminUserRepo;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class CustomUserDetailsService implements UserDetailsService {

    @Autowired
    private IAdminUserRepo adminUserRepo;

    @Override
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        AdminUser admin = adminUserRepo.findByEmailIgnoreCase(email)
                .orElseThrow(() -> {
                    log.warn("Admin user not found with email: {}", email);
                    return new UsernameNotFoundException("Admin user not found with email: " + email);
                });
        log.debug("Loaded admin user {} (role: {})", admin.getEmail(), admin.getRole());
        return User.builder()
                .username(admin.getEmail())
                .password(admin.getPassword())
                .disabled(!admin.isActive())
                .authorities(Collections.singletonList(new SimpleGrantedAuthority("ROLE_" + admin.getRole().name())))
                .build();
    }
}

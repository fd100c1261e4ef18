package com.dradmin.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.dradmin.dto.AdminResponseDTO;
import com.dradmin.dto.CreateAdminRequestDTO;
import com.dradmin.entity.AdminUser;
import com.dradmin.exception.AdminAuthenticationException;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.repository.IAdminUserRepo;

@ExtendWith(MockitoExtension.class)
class AdminServiceTest {

    @Mock
    private IAdminUserRepo adminUserRepo;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private AdminService adminService;

    private AdminUser admin;

    @BeforeEach
    void setUp() {
        admin = new AdminUser();
        admin.setId(1L);
        admin.setEmail("ops@dradmin.local");
        admin.setPassword("$hash");
        admin.setName("Ops");
    }

    @Test
    void loginRecordsLastLogin() {
        when(adminUserRepo.findByEmailIgnoreCase("ops@dradmin.local")).thenReturn(Optional.of(admin));
        when(passwordEncoder.matches("secret", "$hash")).thenReturn(true);
        when(adminUserRepo.save(admin)).thenReturn(admin);

        AdminUser result = adminService.loginAdmin(" ops@dradmin.local ", "secret");

        assertThat(result.getLastLoginAt()).isNotNull();
    }

    @Test
    void wrongPasswordIsRejected() {
        when(adminUserRepo.findByEmailIgnoreCase("ops@dradmin.local")).thenReturn(Optional.of(admin));
        when(passwordEncoder.matches("wrong", "$hash")).thenReturn(false);

        assertThatThrownBy(() -> adminService.loginAdmin("ops@dradmin.local", "wrong"))
                .isInstanceOf(AdminAuthenticationException.class)
                .hasMessage("Invalid username or password.");
        verify(adminUserRepo, never()).save(any());
    }

    @Test
    void disabledAdminCannotLogIn() {
        admin.setActive(false);
        when(adminUserRepo.findByEmailIgnoreCase("ops@dradmin.local")).thenReturn(Optional.of(admin));

        assertThatThrownBy(() -> adminService.loginAdmin("ops@dradmin.local", "secret"))
                .isInstanceOf(AdminAuthenticationException.class);
    }

    @Test
    void blankCredentialsAreBadRequest() {
        assertThatThrownBy(() -> adminService.loginAdmin("", "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createAdminHashesPassword() {
        CreateAdminRequestDTO request = new CreateAdminRequestDTO();
        request.setEmail("New@DrAdmin.local");
        request.setPassword("Passord123");
        request.setName("New");
        request.setRole(AdminUser.Role.SUPPORT);
        when(adminUserRepo.existsByEmailIgnoreCase("New@DrAdmin.local")).thenReturn(false);
        when(passwordEncoder.encode("Passord123")).thenReturn("$encoded");
        when(adminUserRepo.save(any(AdminUser.class))).thenAnswer(inv -> inv.getArgument(0));

        AdminResponseDTO dto = adminService.createAdmin(request);

        ArgumentCaptor<AdminUser> captor = ArgumentCaptor.forClass(AdminUser.class);
        verify(adminUserRepo).save(captor.capture());
        assertThat(captor.getValue().getPassword()).isEqualTo("$encoded");
        assertThat(dto.getEmail()).isEqualTo("new@dradmin.local");
    }

    @Test
    void duplicateAdminIsRejected() {
        CreateAdminRequestDTO request = new CreateAdminRequestDTO();
        request.setEmail("ops@dradmin.local");
        when(adminUserRepo.existsByEmailIgnoreCase("ops@dradmin.local")).thenReturn(true);

        assertThatThrownBy(() -> adminService.createAdmin(request)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void bootstrapOnlyRunsOnEmptyTable() {
        when(adminUserRepo.count()).thenReturn(1L);

        assertThat(adminService.bootstrapAdmin("root@dradmin.local", "changeme")).isFalse();
        verify(adminUserRepo, never()).save(any());
    }

    @Test
    void bootstrapCreatesAdmin() {
        when(adminUserRepo.count()).thenReturn(0L);
        when(passwordEncoder.encode("changeme")).thenReturn("$encoded");

        assertThat(adminService.bootstrapAdmin(" Root@DrAdmin.local ", "changeme")).isTrue();

        ArgumentCaptor<AdminUser> captor = ArgumentCaptor.forClass(AdminUser.class);
        verify(adminUserRepo).save(captor.capture());
        assertThat(captor.getValue().getEmail()).isEqualTo("root@dradmin.local");
        assertThat(captor.getValue().getRole()).isEqualTo(AdminUser.Role.ADMIN);
    }
}

package com.dradmin.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.dto.AdminResponseDTO;
import com.dradmin.dto.CreateAdminRequestDTO;
import com.dradmin.entity.AdminUser;
import com.dradmin.exception.AdminAuthenticationException;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.repository.IAdminUserRepo;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class AdminService {

	@Autowired
	private IAdminUserRepo adminUserRepo;

	@Autowired
	private PasswordEncoder passwordEncoder;

	public AdminUser loginAdmin(String email, String password) {
		if (email == null || password == null || email.isBlank() || password.isBlank()) {
			throw new IllegalArgumentException("Email and password are required");
		}
		AdminUser admin = adminUserRepo.findByEmailIgnoreCase(email.trim()).orElse(null);
		if (admin == null) {
			log.warn("Login failed: admin not found for email: {}", email);
			throw new AdminAuthenticationException("Invalid username or password.");
		}
		if (!admin.isActive()) {
			log.warn("Login failed: admin account disabled for email: {}", email);
			throw new AdminAuthenticationException("Invalid username or password.");
		}
		if (!passwordEncoder.matches(password, admin.getPassword())) {
			log.warn("Login failed: password mismatch for email: {}", email);
			throw new AdminAuthenticationException("Invalid username or password.");
		}
		admin.setLastLoginAt(LocalDateTime.now());
		log.info("Admin login successful for email: {}", admin.getEmail());
		return adminUserRepo.save(admin);
	}

	@Transactional(readOnly = true)
	public List<AdminResponseDTO> getAllAdmins() {
		return adminUserRepo.findAll().stream()
				.map(AdminResponseDTO::fromEntity)
				.collect(Collectors.toList());
	}

	@Transactional(readOnly = true)
	public AdminResponseDTO getByEmail(String email) {
		return adminUserRepo.findByEmailIgnoreCase(email)
				.map(AdminResponseDTO::fromEntity)
				.orElseThrow(() -> new ResourceNotFoundException("Admin user not found: " + email));
	}

	public AdminResponseDTO createAdmin(CreateAdminRequestDTO request) {
		if (adminUserRepo.existsByEmailIgnoreCase(request.getEmail())) {
			throw new BusinessRuleException("An admin user with email " + request.getEmail() + " already exists");
		}
		AdminUser admin = new AdminUser();
		admin.setEmail(request.getEmail().trim().toLowerCase());
		admin.setPassword(passwordEncoder.encode(request.getPassword()));
		admin.setName(request.getName());
		admin.setRole(request.getRole());
		AdminUser saved = adminUserRepo.save(admin);
		log.info("Created admin user {} with role {}", saved.getEmail(), saved.getRole());
		return AdminResponseDTO.fromEntity(saved);
	}

	public AdminResponseDTO setActive(Long id, boolean active) {
		AdminUser admin = adminUserRepo.findById(id)
				.orElseThrow(() -> new ResourceNotFoundException("Admin user", id));
		admin.setActive(active);
		log.info("Admin user {} active={}", admin.getEmail(), active);
		return AdminResponseDTO.fromEntity(adminUserRepo.save(admin));
	}

	/**
	 * Creates the first administrator when the table is empty. Returns false when admins already exist.
	 */
	public boolean bootstrapAdmin(String email, String password) {
		if (adminUserRepo.count() > 0) {
			return false;
		}
		AdminUser admin = new AdminUser();
		admin.setEmail(email.trim().toLowerCase());
		admin.setPassword(passwordEncoder.encode(password));
		admin.setName("Administrator");
		admin.setRole(AdminUser.Role.ADMIN);
		adminUserRepo.save(admin);
		log.info("Bootstrapped initial admin user {}", admin.getEmail());
		return true;
	}
}

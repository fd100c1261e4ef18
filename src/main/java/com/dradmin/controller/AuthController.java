package com.dradmin.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.dto.AdminLoginRequestDTO;
import com.dradmin.dto.AdminResponseDTO;
import com.dradmin.dto.CreateAdminRequestDTO;
import com.dradmin.dto.LoginResponseDTO;
import com.dradmin.entity.AdminUser;
import com.dradmin.security.JwtAuthenticationFilter;
import com.dradmin.security.JwtUtil;
import com.dradmin.security.SecurityUtils;
import com.dradmin.service.AdminService;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/auth")
public class AuthController {

	@Autowired
	private AdminService adminService;

	@Autowired
	private JwtUtil jwtUtil;

	@PostMapping("/login")
	public ResponseEntity<LoginResponseDTO> login(@Valid @RequestBody AdminLoginRequestDTO loginRequest,
			HttpServletResponse response) {
		AdminUser admin = adminService.loginAdmin(loginRequest.getEmail(), loginRequest.getPassword());
		String token = jwtUtil.generateToken(admin.getEmail(), admin.getRole().name());

		ResponseCookie cookie = ResponseCookie.from(JwtAuthenticationFilter.AUTH_COOKIE, token)
				.httpOnly(true)
				.secure(true)
				.path("/")
				.maxAge(jwtUtil.getExpirationMs() / 1000)
				.sameSite("None")
				.build();
		response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());

		return ResponseEntity.ok(new LoginResponseDTO(token, AdminResponseDTO.fromEntity(admin)));
	}

	@PostMapping("/logout")
	public ResponseEntity<Void> logout(HttpServletResponse response) {
		ResponseCookie cookie = ResponseCookie.from(JwtAuthenticationFilter.AUTH_COOKIE, "")
				.httpOnly(true)
				.secure(true)
				.path("/")
				.maxAge(0)
				.sameSite("None")
				.build();
		response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
		return ResponseEntity.noContent().build();
	}

	@GetMapping("/me")
	public ResponseEntity<AdminResponseDTO> me() {
		return ResponseEntity.ok(adminService.getByEmail(SecurityUtils.currentAdmin()));
	}

	@GetMapping("/admins")
	@PreAuthorize("hasRole('ADMIN')")
	public ResponseEntity<List<AdminResponseDTO>> listAdmins() {
		return ResponseEntity.ok(adminService.getAllAdmins());
	}

	@PostMapping("/admins")
	@PreAuthorize("hasRole('ADMIN')")
	public ResponseEntity<AdminResponseDTO> createAdmin(@Valid @RequestBody CreateAdminRequestDTO request) {
		log.info("ADMIN {}: Creating admin user {}", SecurityUtils.currentAdmin(), request.getEmail());
		return ResponseEntity.status(HttpStatus.CREATED).body(adminService.createAdmin(request));
	}

	@PatchMapping("/admins/{id}/active")
	@PreAuthorize("hasRole('ADMIN')")
	public ResponseEntity<AdminResponseDTO> setActive(@PathVariable Long id, @RequestParam boolean active) {
		log.info("ADMIN {}: Setting admin user {} active={}", SecurityUtils.currentAdmin(), id, active);
		return ResponseEntity.ok(adminService.setActive(id, active));
	}
}

package com.dradmin.dto;

import java.time.LocalDateTime;

import com.dradmin.entity.AdminUser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminResponseDTO {
	private Long id;
	private String email;
	private String name;
	private String role;
	private boolean active;
	private LocalDateTime lastLoginAt;

	public static AdminResponseDTO fromEntity(AdminUser admin) {
		return AdminResponseDTO.builder()
				.id(admin.getId())
				.email(admin.getEmail())
				.name(admin.getName())
				.role(admin.getRole().name())
				.active(admin.isActive())
				.lastLoginAt(admin.getLastLoginAt())
				.build();
	}
}

package com.dradmin.dto;

import com.dradmin.entity.AdminUser;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateAdminRequestDTO {
	@NotBlank
	@Email
	private String email;

	@NotBlank
	@Size(min = 8, message = "Password must be at least 8 characters")
	private String password;

	private String name;

	@NotNull
	private AdminUser.Role role;
}

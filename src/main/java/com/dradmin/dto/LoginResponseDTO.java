package com.dradmin.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponseDTO {
    private String token;
    private String tokenType = "Bearer";
    private AdminResponseDTO user;

    public LoginResponseDTO(String token, AdminResponseDTO user) {
        this.token = token;
        this.user = user;
    }
}

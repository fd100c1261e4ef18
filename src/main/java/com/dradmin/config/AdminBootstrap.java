package com.dradmin.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.dradmin.service.AdminService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final AdminService adminService;

    @Value("${dradmin.admin.bootstrap-email:}")
    private String bootstrapEmail;

    @Value("${dradmin.admin.bootstrap-password:}")
    private String bootstrapPassword;

    @Override
    public void run(ApplicationArguments args) {
        if (bootstrapEmail.isBlank() || bootstrapPassword.isBlank()) {
            return;
        }
        if (!adminService.bootstrapAdmin(bootstrapEmail, bootstrapPassword)) {
            log.debug("Admin users already present, skipping bootstrap");
        }
    }
}

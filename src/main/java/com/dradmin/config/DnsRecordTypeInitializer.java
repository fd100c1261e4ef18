package com.dradmin.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.dradmin.dns.service.DnsRecordTypeService;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class DnsRecordTypeInitializer implements ApplicationRunner {

    private final DnsRecordTypeService recordTypeService;

    @Override
    public void run(ApplicationArguments args) {
        recordTypeService.seedDefaults();
    }
}

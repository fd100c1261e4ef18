package com.dradmin.registrar.client;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.dradmin.registrar.entity.Tld;

/**
 * Offline registrar with a fixed USD price table, for test and demo installations.
 */
@Component
public class SandboxRegistrarClient implements DomainRegistrarClient {

    public static final String CODE = "sandbox";

    private static final Map<String, TldPriceInfo> PRICES = new LinkedHashMap<>();

    static {
        add("com", "9.99", "12.99", "9.99");
        add("net", "11.99", "14.99", "11.99");
        add("org", "10.99", "13.99", "10.99");
        add("io", "39.99", "49.99", "39.99");
        add("dev", "14.99", "16.99", "14.99");
        add("co", "24.99", "29.99", "24.99");
        add("info", "4.99", "19.99", "14.99");
        add("biz", "12.99", "17.99", "12.99");
        add("xyz", "1.99", "13.99", "11.99");
        add("app", "16.99", "18.99", "16.99");
    }

    private static void add(String ext, String registration, String renewal, String transfer) {
        PRICES.put(ext, TldPriceInfo.builder()
                .extension(ext)
                .registrationPrice(new BigDecimal(registration))
                .renewalPrice(new BigDecimal(renewal))
                .transferPrice(new BigDecimal(transfer))
                .currency("USD")
                .minYears(1)
                .maxYears(10)
                .build());
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public List<TldPriceInfo> getSupportedTlds(Collection<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return List.copyOf(PRICES.values());
        }
        Set<String> wanted = extensions.stream().map(Tld::normalize).collect(Collectors.toSet());
        return PRICES.values().stream()
                .filter(p -> wanted.contains(p.getExtension()))
                .collect(Collectors.toList());
    }
}

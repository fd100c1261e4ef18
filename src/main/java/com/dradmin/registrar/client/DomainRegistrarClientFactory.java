package com.dradmin.registrar.client;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.dradmin.exception.ExternalServiceException;

@Component
public class DomainRegistrarClientFactory {

    private final Map<String, DomainRegistrarClient> clients;

    public DomainRegistrarClientFactory(List<DomainRegistrarClient> clients) {
        this.clients = clients.stream()
                .collect(Collectors.toMap(c -> c.code().toLowerCase(), Function.identity()));
    }

    public DomainRegistrarClient createRegistrar(String code) {
        DomainRegistrarClient client = code == null ? null : clients.get(code.trim().toLowerCase());
        if (client == null) {
            throw new ExternalServiceException("No registrar client available for code: " + code);
        }
        return client;
    }
}

package com.dradmin.registrar.client;

import java.util.Collection;
import java.util.List;

/**
 * Registrar API used for price downloads.
 */
public interface DomainRegistrarClient {

    /**
     * Registrar code this client serves, matched case-insensitively against {@code Registrar.code}.
     */
    String code();

    /**
     * Prices for the requested extensions. Extensions the registrar does not sell are left out.
     * An empty collection asks for everything the registrar sells.
     *
     * @throws com.dradmin.exception.ExternalServiceException when the registrar cannot be reached
     */
    List<TldPriceInfo> getSupportedTlds(Collection<String> extensions);
}

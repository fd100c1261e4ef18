package com.dradmin.billing.service;

import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Service;

import com.dradmin.billing.dto.RefundDTO;
import com.dradmin.exception.NotImplementedFeatureException;

import lombok.extern.slf4j.Slf4j;

/**
 * Placeholder until gateway refunds are wired up. Listings are empty, everything else reports 501.
 */
@Slf4j
@Service
public class RefundService {

    public List<RefundDTO> getAllRefunds() {
        return Collections.emptyList();
    }

    public List<RefundDTO> getRefundsByInvoice(Long invoiceId) {
        return Collections.emptyList();
    }

    public RefundDTO getRefundById(Long id) {
        throw new NotImplementedFeatureException("Refund lookup");
    }

    public RefundDTO createRefund(RefundDTO request) {
        log.warn("Refund requested for invoice {} but refunds are not implemented", request.getInvoiceId());
        throw new NotImplementedFeatureException("Refund creation");
    }

    public RefundDTO processRefund(Long id) {
        throw new NotImplementedFeatureException("Refund processing");
    }
}

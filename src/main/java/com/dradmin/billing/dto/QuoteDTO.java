package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import com.dradmin.billing.entity.Quote;
import com.dradmin.billing.entity.Quote.QuoteStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteDTO {
    private Long id;
    private String quoteNumber;
    private Long customerId;
    private String customerName;
    private QuoteStatus status;
    private LocalDate validUntil;
    private BigDecimal subTotal;
    private BigDecimal totalSetupFee;
    private BigDecimal discountAmount;
    private BigDecimal taxAmount;
    private BigDecimal totalAmount;
    private String currencyCode;
    private BigDecimal taxRate;
    private String taxName;
    private String couponCode;
    private String notes;
    private LocalDateTime sentAt;
    private LocalDateTime acceptedAt;
    private LocalDateTime rejectedAt;
    private String rejectionReason;
    private String acceptanceToken;
    private Long invoiceId;
    private List<QuoteLineDTO> lines;
    private LocalDateTime createdAt;

    public static QuoteDTO summaryOf(Quote quote) {
        return QuoteDTO.builder()
                .id(quote.getId())
                .quoteNumber(quote.getQuoteNumber())
                .customerId(quote.getCustomer().getId())
                .customerName(quote.getCustomer().getName())
                .status(quote.getStatus())
                .validUntil(quote.getValidUntil())
                .subTotal(quote.getSubTotal())
                .totalSetupFee(quote.getTotalSetupFee())
                .discountAmount(quote.getDiscountAmount())
                .taxAmount(quote.getTaxAmount())
                .totalAmount(quote.getTotalAmount())
                .currencyCode(quote.getCurrencyCode())
                .taxRate(quote.getTaxRate())
                .taxName(quote.getTaxName())
                .couponCode(quote.getCoupon() != null ? quote.getCoupon().getCode() : null)
                .notes(quote.getNotes())
                .sentAt(quote.getSentAt())
                .acceptedAt(quote.getAcceptedAt())
                .rejectedAt(quote.getRejectedAt())
                .rejectionReason(quote.getRejectionReason())
                .acceptanceToken(quote.getAcceptanceToken())
                .invoiceId(quote.getInvoiceId())
                .createdAt(quote.getCreatedAt())
                .build();
    }

    public static QuoteDTO fromEntity(Quote quote) {
        QuoteDTO dto = summaryOf(quote);
        dto.setLines(quote.getLines().stream().map(QuoteLineDTO::fromEntity).collect(Collectors.toList()));
        return dto;
    }
}

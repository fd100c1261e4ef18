package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.Invoice.InvoiceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceDTO {
    private Long id;
    private String invoiceNumber;
    private Long customerId;
    private String customerName;
    private InvoiceStatus status;
    private LocalDate issueDate;
    private LocalDate dueDate;
    private LocalDateTime paidAt;
    private String currencyCode;
    private BigDecimal subTotal;
    private BigDecimal taxAmount;
    private BigDecimal totalAmount;
    private BigDecimal amountPaid;
    private BigDecimal amountDue;
    private BigDecimal taxRate;
    private String taxName;
    private String notes;
    private List<InvoiceLineDTO> lines;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * Header fields only; lines are left null.
     */
    public static InvoiceDTO summaryOf(Invoice invoice) {
        return InvoiceDTO.builder()
                .id(invoice.getId())
                .invoiceNumber(invoice.getInvoiceNumber())
                .customerId(invoice.getCustomer().getId())
                .customerName(invoice.getCustomer().getName())
                .status(invoice.getStatus())
                .issueDate(invoice.getIssueDate())
                .dueDate(invoice.getDueDate())
                .paidAt(invoice.getPaidAt())
                .currencyCode(invoice.getCurrencyCode())
                .subTotal(invoice.getSubTotal())
                .taxAmount(invoice.getTaxAmount())
                .totalAmount(invoice.getTotalAmount())
                .amountPaid(invoice.getAmountPaid())
                .amountDue(invoice.getAmountDue())
                .taxRate(invoice.getTaxRate())
                .taxName(invoice.getTaxName())
                .notes(invoice.getNotes())
                .createdAt(invoice.getCreatedAt())
                .updatedAt(invoice.getUpdatedAt())
                .build();
    }

    public static InvoiceDTO fromEntity(Invoice invoice) {
        InvoiceDTO dto = summaryOf(invoice);
        dto.setLines(invoice.getLines().stream().map(InvoiceLineDTO::fromEntity).collect(Collectors.toList()));
        return dto;
    }
}

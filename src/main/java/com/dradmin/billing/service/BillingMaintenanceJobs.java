package com.dradmin.billing.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class BillingMaintenanceJobs {

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private QuoteService quoteService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private CurrencyService currencyService;

    @Scheduled(cron = "${dradmin.invoices.overdue-cron:0 0 1 * * *}")
    public void markOverdueInvoices() {
        int count = invoiceService.markOverdueInvoices();
        log.info("Overdue invoice job finished, {} invoices updated", count);
    }

    @Scheduled(cron = "${dradmin.quotes.expire-cron:0 10 1 * * *}")
    public void expireQuotes() {
        int count = quoteService.expireOutdatedQuotes();
        log.info("Quote expiry job finished, {} quotes expired", count);
    }

    @Scheduled(cron = "${dradmin.payments.expire-cron:0 */15 * * * *}")
    public void expireCheckoutSessions() {
        int count = paymentService.markExpiredSessions();
        int rates = currencyService.deactivateExpiredRates();
        log.debug("Expired {} checkout sessions and {} exchange rates", count, rates);
    }
}

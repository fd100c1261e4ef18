package com.dradmin.registrar.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.email.dto.QueueEmailRequest;
import com.dradmin.email.service.EmailQueueService;
import com.dradmin.entity.Customer;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;
import com.dradmin.registrar.repository.RegisteredDomainRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Queues expiry reminders for active domains and marks lapsed domains as expired.
 */
@Slf4j
@Component
public class DomainExpirationMonitor {

    public static final String RELATED_ENTITY_TYPE = "RegisteredDomain";

    @Autowired
    private RegisteredDomainRepository domainRepository;

    @Autowired
    private EmailQueueService emailQueueService;

    @Value("${dradmin.domains.expiry-warning-days:30}")
    private int warningDays;

    @Scheduled(cron = "${dradmin.domains.expiry-cron:0 0 */6 * * *}")
    @Transactional
    public void checkExpirations() {
        int reminders = queueExpiryReminders();
        int expired = markExpiredDomains();
        log.info("Domain expiration check completed: {} reminders queued, {} domains expired", reminders, expired);
    }

    /**
     * One reminder per domain and warning window.
     */
    @Transactional
    public int queueExpiryReminders() {
        LocalDate today = LocalDate.now();
        List<RegisteredDomain> expiring = domainRepository.findExpiringBetween(DomainStatus.ACTIVE, today,
                today.plusDays(warningDays));
        int queued = 0;
        for (RegisteredDomain domain : expiring) {
            LocalDate windowStart = domain.getExpirationDate().minusDays(warningDays);
            if (domain.getExpiryNoticeSentOn() != null && !domain.getExpiryNoticeSentOn().isBefore(windowStart)) {
                continue;
            }
            Customer customer = domain.getCustomer();
            String to = customer.getInvoiceEmail();
            if (to == null || to.isBlank()) {
                log.warn("Customer {} has no email, skipping expiry reminder for {}", customer.getId(), domain.getName());
                continue;
            }
            long days = ChronoUnit.DAYS.between(today, domain.getExpirationDate());
            emailQueueService.queueEmail(QueueEmailRequest.builder()
                    .to(to)
                    .subject("Domain " + domain.getName() + " expires in " + days + " days")
                    .bodyText(reminderText(domain, customer, days))
                    .customerId(customer.getId())
                    .relatedEntityType(RELATED_ENTITY_TYPE)
                    .relatedEntityId(domain.getId())
                    .build());
            domain.setExpiryNoticeSentOn(today);
            domainRepository.save(domain);
            queued++;
        }
        return queued;
    }

    @Transactional
    public int markExpiredDomains() {
        List<RegisteredDomain> expired = domainRepository.findActiveExpiredBefore(LocalDate.now());
        for (RegisteredDomain domain : expired) {
            log.warn("Marking domain {} as expired (expired on {})", domain.getName(), domain.getExpirationDate());
            domain.setStatus(DomainStatus.EXPIRED);
            domainRepository.save(domain);
        }
        return expired.size();
    }

    private String reminderText(RegisteredDomain domain, Customer customer, long days) {
        return "Dear " + customer.getName() + ",\n\n"
                + "Your domain " + domain.getName() + " expires on "
                + domain.getExpirationDate().format(DateTimeFormatter.ISO_LOCAL_DATE)
                + " (in " + days + " days).\n"
                + (domain.isAutoRenew()
                        ? "Auto-renewal is enabled, no action is needed.\n"
                        : "Please renew it before that date to keep it active.\n");
    }
}

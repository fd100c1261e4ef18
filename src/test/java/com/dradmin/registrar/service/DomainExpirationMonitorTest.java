package com.dradmin.registrar.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.dradmin.email.dto.QueueEmailRequest;
import com.dradmin.email.service.EmailQueueService;
import com.dradmin.entity.Customer;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;
import com.dradmin.registrar.repository.RegisteredDomainRepository;

@ExtendWith(MockitoExtension.class)
class DomainExpirationMonitorTest {

    @Mock
    private RegisteredDomainRepository domainRepository;

    @Mock
    private EmailQueueService emailQueueService;

    @InjectMocks
    private DomainExpirationMonitor monitor;

    private final LocalDate today = LocalDate.now();
    private Customer customer;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(monitor, "warningDays", 30);
        customer = Customer.builder().id(4L).name("Fjord Media").email("post@fjord.no").billingEmail("faktura@fjord.no").build();
    }

    private RegisteredDomain domain(String name, int daysLeft) {
        return RegisteredDomain.builder()
                .id((long) name.length())
                .name(name)
                .customer(customer)
                .status(DomainStatus.ACTIVE)
                .expirationDate(today.plusDays(daysLeft))
                .build();
    }

    @Test
    void queuesReminderToBillingAddressOnce() {
        RegisteredDomain domain = domain("fjord.no", 12);
        when(domainRepository.findExpiringBetween(DomainStatus.ACTIVE, today, today.plusDays(30))).thenReturn(List.of(domain));

        assertThat(monitor.queueExpiryReminders()).isEqualTo(1);

        ArgumentCaptor<QueueEmailRequest> captor = ArgumentCaptor.forClass(QueueEmailRequest.class);
        verify(emailQueueService).queueEmail(captor.capture());
        QueueEmailRequest request = captor.getValue();
        assertThat(request.getTo()).isEqualTo("faktura@fjord.no");
        assertThat(request.getSubject()).isEqualTo("Domain fjord.no expires in 12 days");
        assertThat(request.getBodyText()).contains("Please renew it");
        assertThat(request.getRelatedEntityType()).isEqualTo(DomainExpirationMonitor.RELATED_ENTITY_TYPE);
        assertThat(domain.getExpiryNoticeSentOn()).isEqualTo(today);
        verify(domainRepository).save(domain);
    }

    @Test
    void reminderAlreadySentInThisWindowIsSkipped() {
        RegisteredDomain domain = domain("fjord.no", 12);
        domain.setExpiryNoticeSentOn(today.minusDays(3));
        when(domainRepository.findExpiringBetween(DomainStatus.ACTIVE, today, today.plusDays(30))).thenReturn(List.of(domain));

        assertThat(monitor.queueExpiryReminders()).isZero();
        verify(emailQueueService, never()).queueEmail(any());
    }

    @Test
    void reminderFromPreviousTermIsSentAgain() {
        RegisteredDomain domain = domain("fjord.no", 20);
        domain.setAutoRenew(true);
        domain.setExpiryNoticeSentOn(today.minusYears(1));
        when(domainRepository.findExpiringBetween(DomainStatus.ACTIVE, today, today.plusDays(30))).thenReturn(List.of(domain));

        assertThat(monitor.queueExpiryReminders()).isEqualTo(1);

        ArgumentCaptor<QueueEmailRequest> captor = ArgumentCaptor.forClass(QueueEmailRequest.class);
        verify(emailQueueService).queueEmail(captor.capture());
        assertThat(captor.getValue().getBodyText()).contains("Auto-renewal is enabled");
    }

    @Test
    void lapsedDomainsAreMarkedExpired() {
        RegisteredDomain lapsed = domain("gammel.no", -2);
        when(domainRepository.findActiveExpiredBefore(eq(today))).thenReturn(List.of(lapsed));

        assertThat(monitor.markExpiredDomains()).isEqualTo(1);
        assertThat(lapsed.getStatus()).isEqualTo(DomainStatus.EXPIRED);
        verify(domainRepository).save(lapsed);
    }
}

package com.dradmin.registrar.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.email.entity.SentEmail;
import com.dradmin.email.repository.SentEmailRepository;
import com.dradmin.email.service.EmailQueueService;
import com.dradmin.entity.Customer;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;
import com.dradmin.registrar.entity.Tld;
import com.dradmin.registrar.repository.RegisteredDomainRepository;
import com.dradmin.registrar.repository.TldRepository;
import com.dradmin.repository.ICustomerRepo;

/**
 * Runs the scheduled check outside a test transaction, the way the scheduler calls it.
 */
@DataJpaTest
@Import({DomainExpirationMonitor.class, EmailQueueService.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DomainExpirationMonitorIntegrationTest {

    @Autowired
    private DomainExpirationMonitor monitor;

    @Autowired
    private ICustomerRepo customerRepo;

    @Autowired
    private TldRepository tldRepository;

    @Autowired
    private RegisteredDomainRepository domainRepository;

    @Autowired
    private SentEmailRepository sentEmailRepository;

    private final LocalDate today = LocalDate.now();

    @AfterEach
    void cleanUp() {
        sentEmailRepository.deleteAll();
        domainRepository.deleteAll();
        tldRepository.deleteAll();
        customerRepo.deleteAll();
    }

    @Test
    void scheduledCheckQueuesReminderAndExpiresLapsedDomains() {
        Customer customer = customerRepo.save(Customer.builder()
                .referenceNumber(1001L)
                .name("Nordlys AS")
                .email("post@nordlys.no")
                .build());
        Tld tld = tldRepository.save(Tld.builder().extension("no").build());
        domainRepository.save(RegisteredDomain.builder()
                .name("nordlys.no")
                .customer(customer)
                .tld(tld)
                .status(DomainStatus.ACTIVE)
                .expirationDate(today.plusDays(5))
                .build());
        domainRepository.save(RegisteredDomain.builder()
                .name("gammel.no")
                .customer(customer)
                .tld(tld)
                .status(DomainStatus.ACTIVE)
                .expirationDate(today.minusDays(2))
                .build());

        monitor.checkExpirations();

        List<SentEmail> queued = sentEmailRepository.findAll();
        assertThat(queued).hasSize(1);
        assertThat(queued.get(0).getTo()).isEqualTo("post@nordlys.no");
        assertThat(queued.get(0).getSubject()).isEqualTo("Domain nordlys.no expires in 5 days");
        assertThat(domainRepository.findByNameIgnoreCase("nordlys.no").orElseThrow().getExpiryNoticeSentOn())
                .isEqualTo(today);
        assertThat(domainRepository.findByNameIgnoreCase("gammel.no").orElseThrow().getStatus())
                .isEqualTo(DomainStatus.EXPIRED);
    }
}

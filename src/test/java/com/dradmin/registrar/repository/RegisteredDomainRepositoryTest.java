package com.dradmin.registrar.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import com.dradmin.entity.Customer;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;
import com.dradmin.registrar.entity.Tld;

@DataJpaTest
class RegisteredDomainRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private RegisteredDomainRepository domainRepository;

    private final LocalDate today = LocalDate.now();
    private Customer customer;
    private Tld tld;

    @BeforeEach
    void setUp() {
        customer = entityManager.persist(Customer.builder().referenceNumber(1001L).name("Nordlys AS").email("post@nordlys.no").build());
        tld = entityManager.persist(Tld.builder().extension("no").build());
    }

    private void domain(String name, DomainStatus status, LocalDate expires) {
        entityManager.persist(RegisteredDomain.builder()
                .name(name)
                .customer(customer)
                .tld(tld)
                .status(status)
                .expirationDate(expires)
                .build());
    }

    @Test
    void expiringWindowIsInclusiveAndSorted() {
        domain("b.no", DomainStatus.ACTIVE, today.plusDays(30));
        domain("a.no", DomainStatus.ACTIVE, today.plusDays(3));
        domain("c.no", DomainStatus.ACTIVE, today.plusDays(31));
        domain("d.no", DomainStatus.SUSPENDED, today.plusDays(5));
        entityManager.flush();

        assertThat(domainRepository.findExpiringBetween(DomainStatus.ACTIVE, today, today.plusDays(30)))
                .extracting(RegisteredDomain::getName)
                .containsExactly("a.no", "b.no");
    }

    @Test
    void onlyActiveLapsedDomainsAreReturned() {
        domain("gammel.no", DomainStatus.ACTIVE, today.minusDays(1));
        domain("idag.no", DomainStatus.ACTIVE, today);
        domain("borte.no", DomainStatus.EXPIRED, today.minusDays(10));
        entityManager.flush();

        assertThat(domainRepository.findActiveExpiredBefore(today))
                .extracting(RegisteredDomain::getName)
                .containsExactly("gammel.no");
    }

    @Test
    void nameLookupIgnoresCase() {
        domain("nordlys.no", DomainStatus.ACTIVE, today.plusYears(1));
        entityManager.flush();

        assertThat(domainRepository.existsByNameIgnoreCase("NORDLYS.no")).isTrue();
        assertThat(domainRepository.findByNameIgnoreCase("Nordlys.NO")).isPresent();
    }
}

package com.dradmin.dns.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.dns.dto.DnsRecordDTO;
import com.dradmin.dns.entity.DnsRecord;
import com.dradmin.dns.entity.DnsRecordType;
import com.dradmin.dns.repository.DnsRecordRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.service.RegisteredDomainService;

@ExtendWith(MockitoExtension.class)
class DnsRecordServiceTest {

    @Mock
    private DnsRecordRepository recordRepository;

    @Mock
    private DnsRecordTypeService recordTypeService;

    @Mock
    private RegisteredDomainService domainService;

    @InjectMocks
    private DnsRecordService recordService;

    private RegisteredDomain domain;
    private DnsRecordType mx;

    @BeforeEach
    void setUp() {
        domain = RegisteredDomain.builder().id(1L).name("example.no").build();
        mx = DnsRecordType.builder().id(4L).type("MX").hasPriority(true).defaultTtl(3600).build();
    }

    @Test
    void createRecordUsesTypeDefaultTtlAndIsPendingSync() {
        when(domainService.getDomainEntity(1L)).thenReturn(domain);
        when(recordTypeService.getRecordTypeEntity("MX")).thenReturn(mx);
        when(recordRepository.save(any(DnsRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        DnsRecordDTO dto = recordService.createRecord(DnsRecordDTO.builder()
                .domainId(1L).type("MX").name(" @ ").value("mail.example.no").priority(10).weight(5).build());

        assertThat(dto.getTtl()).isEqualTo(3600);
        assertThat(dto.getName()).isEqualTo("@");
        assertThat(dto.getPriority()).isEqualTo(10);
        assertThat(dto.getWeight()).isNull();
        assertThat(dto.isPendingSync()).isTrue();
        assertThat(dto.getDomainName()).isEqualTo("example.no");
    }

    @Test
    void missingPriorityIsRejected() {
        when(domainService.getDomainEntity(1L)).thenReturn(domain);
        when(recordTypeService.getRecordTypeEntity("MX")).thenReturn(mx);

        DnsRecordDTO dto = DnsRecordDTO.builder().domainId(1L).type("MX").name("@").value("mail.example.no").build();

        assertThatThrownBy(() -> recordService.createRecord(dto))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("priority");
        verify(recordRepository, never()).save(any());
    }

    @Test
    void inactiveTypeIsRejected() {
        mx.setActive(false);
        when(recordTypeService.getRecordTypeEntity("MX")).thenReturn(mx);

        assertThatThrownBy(() -> recordService.activeType("MX")).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void softDeleteAndRestoreFlagRecordForSync() {
        DnsRecord record = DnsRecord.builder().id(9L).domain(domain).type(mx).name("@").value("mx")
                .priority(10).pendingSync(false).build();
        when(recordRepository.findById(9L)).thenReturn(Optional.of(record));
        when(recordRepository.save(record)).thenReturn(record);

        assertThat(recordService.softDeleteRecord(9L).isDeleted()).isTrue();
        assertThat(record.isPendingSync()).isTrue();

        record.setPendingSync(false);
        assertThat(recordService.restoreRecord(9L).isDeleted()).isFalse();
        assertThat(record.isPendingSync()).isTrue();
    }

    @Test
    void restoringActiveRecordIsRejected() {
        DnsRecord record = DnsRecord.builder().id(9L).domain(domain).type(mx).name("@").value("mx").build();
        when(recordRepository.findById(9L)).thenReturn(Optional.of(record));

        assertThatThrownBy(() -> recordService.restoreRecord(9L)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void deletedRecordCannotBeUpdated() {
        DnsRecord record = DnsRecord.builder().id(9L).domain(domain).type(mx).name("@").value("mx").deleted(true).build();
        when(recordRepository.findById(9L)).thenReturn(Optional.of(record));

        DnsRecordDTO dto = DnsRecordDTO.builder().domainId(1L).type("MX").name("@").value("mx2").priority(5).build();

        assertThatThrownBy(() -> recordService.updateRecord(9L, dto)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void pagingIsOneBased() {
        assertThatThrownBy(() -> recordService.getRecordsPaged(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recordService.getRecordsPaged(1, 501)).isInstanceOf(IllegalArgumentException.class);
    }
}

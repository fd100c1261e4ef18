package com.dradmin.dns.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.dns.dto.DnsZonePackageDTO;
import com.dradmin.dns.dto.DnsZonePackageRecordDTO;
import com.dradmin.dns.entity.DnsRecord;
import com.dradmin.dns.entity.DnsRecordType;
import com.dradmin.dns.entity.DnsZonePackage;
import com.dradmin.dns.entity.DnsZonePackageRecord;
import com.dradmin.dns.repository.DnsRecordRepository;
import com.dradmin.dns.repository.DnsZonePackageRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.service.RegisteredDomainService;

@ExtendWith(MockitoExtension.class)
class DnsZonePackageServiceTest {

    @Mock
    private DnsZonePackageRepository packageRepository;

    @Mock
    private DnsRecordRepository recordRepository;

    @Mock
    private DnsRecordService recordService;

    @Mock
    private RegisteredDomainService domainService;

    @InjectMocks
    private DnsZonePackageService packageService;

    private final DnsRecordType a = DnsRecordType.builder().id(1L).type("A").defaultTtl(3600).build();
    private final DnsRecordType cname = DnsRecordType.builder().id(3L).type("CNAME").defaultTtl(1800).build();

    @Test
    void applyPackageSubstitutesDomainName() {
        DnsZonePackage zonePackage = DnsZonePackage.builder().id(5L).name("Web hosting").build();
        zonePackage.addRecord(DnsZonePackageRecord.builder().type(a).name("@").value("192.0.2.10").ttl(300).build());
        zonePackage.addRecord(DnsZonePackageRecord.builder().type(cname).name("www").value("{domain}.").build());
        when(packageRepository.findWithRecordsById(5L)).thenReturn(Optional.of(zonePackage));
        when(domainService.getDomainEntity(2L)).thenReturn(RegisteredDomain.builder().id(2L).name("example.no").build());

        int created = packageService.applyPackageToDomain(5L, 2L);

        assertThat(created).isEqualTo(2);
        ArgumentCaptor<DnsRecord> captor = ArgumentCaptor.forClass(DnsRecord.class);
        verify(recordRepository, times(2)).save(captor.capture());
        List<DnsRecord> records = captor.getAllValues();
        assertThat(records.get(0).getTtl()).isEqualTo(300);
        assertThat(records.get(1).getValue()).isEqualTo("example.no.");
        assertThat(records.get(1).getTtl()).isEqualTo(1800);
        assertThat(records).allMatch(DnsRecord::isPendingSync);
    }

    @Test
    void inactivePackageCannotBeApplied() {
        DnsZonePackage zonePackage = DnsZonePackage.builder().id(5L).name("Old").active(false).build();
        when(packageRepository.findWithRecordsById(5L)).thenReturn(Optional.of(zonePackage));

        assertThatThrownBy(() -> packageService.applyPackageToDomain(5L, 2L)).isInstanceOf(BusinessRuleException.class);
        verify(recordRepository, never()).save(any());
    }

    @Test
    void newDefaultPackageClearsPreviousDefault() {
        DnsZonePackage previous = DnsZonePackage.builder().id(1L).name("Old default").defaultPackage(true).build();
        when(recordService.activeType("A")).thenReturn(a);
        when(packageRepository.save(any(DnsZonePackage.class))).thenAnswer(inv -> {
            DnsZonePackage p = inv.getArgument(0);
            if (p.getId() == null) {
                p.setId(2L);
            }
            return p;
        });
        when(packageRepository.findByDefaultPackageTrue()).thenReturn(List.of(previous));

        DnsZonePackageDTO dto = packageService.createPackage(DnsZonePackageDTO.builder()
                .name("Standard")
                .defaultPackage(true)
                .records(List.of(DnsZonePackageRecordDTO.builder().type("A").name("@").value("192.0.2.1").build()))
                .build());

        assertThat(dto.isDefaultPackage()).isTrue();
        assertThat(dto.getRecords()).hasSize(1);
        assertThat(dto.getRecords().get(0).getTtl()).isEqualTo(3600);
        assertThat(previous.isDefaultPackage()).isFalse();
    }

    @Test
    void removingUnknownTemplateRecordIsNotFound() {
        DnsZonePackage zonePackage = DnsZonePackage.builder().id(5L).name("Web").build();
        when(packageRepository.findWithRecordsById(5L)).thenReturn(Optional.of(zonePackage));

        assertThatThrownBy(() -> packageService.removeRecord(5L, 77L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void missingDefaultPackageIsNotFound() {
        when(packageRepository.findFirstByDefaultPackageTrue()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> packageService.getDefaultPackage()).isInstanceOf(ResourceNotFoundException.class);
    }
}

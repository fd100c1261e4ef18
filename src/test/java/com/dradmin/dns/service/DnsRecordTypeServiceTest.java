package com.dradmin.dns.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.dns.dto.DnsRecordTypeDTO;
import com.dradmin.dns.entity.DnsRecordType;
import com.dradmin.dns.repository.DnsRecordTypeRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

@ExtendWith(MockitoExtension.class)
class DnsRecordTypeServiceTest {

    @Mock
    private DnsRecordTypeRepository recordTypeRepository;

    @InjectMocks
    private DnsRecordTypeService recordTypeService;

    @Test
    void seedCreatesOnlyMissingTypes() {
        when(recordTypeRepository.existsByTypeIgnoreCase(anyString())).thenReturn(false);
        when(recordTypeRepository.existsByTypeIgnoreCase("A")).thenReturn(true);
        when(recordTypeRepository.existsByTypeIgnoreCase("MX")).thenReturn(true);

        int created = recordTypeService.seedDefaults();

        assertThat(created).isEqualTo(8);
        ArgumentCaptor<DnsRecordType> captor = ArgumentCaptor.forClass(DnsRecordType.class);
        verify(recordTypeRepository, times(8)).save(captor.capture());
        DnsRecordType srv = captor.getAllValues().stream().filter(t -> t.getType().equals("SRV")).findFirst().orElseThrow();
        assertThat(srv.isHasPriority()).isTrue();
        assertThat(srv.isHasWeight()).isTrue();
        assertThat(srv.isHasPort()).isTrue();
    }

    @Test
    void duplicateTypeIsRejected() {
        when(recordTypeRepository.existsByTypeIgnoreCase("txt")).thenReturn(true);

        DnsRecordTypeDTO dto = DnsRecordTypeDTO.builder().type("txt ").build();

        assertThatThrownBy(() -> recordTypeService.createRecordType(dto)).isInstanceOf(BusinessRuleException.class);
        verify(recordTypeRepository, never()).save(any());
    }

    @Test
    void createdTypeIsUpperCased() {
        when(recordTypeRepository.existsByTypeIgnoreCase("naptr")).thenReturn(false);
        when(recordTypeRepository.save(any(DnsRecordType.class))).thenAnswer(inv -> inv.getArgument(0));

        DnsRecordTypeDTO dto = recordTypeService.createRecordType(DnsRecordTypeDTO.builder()
                .type("naptr").hasPriority(true).active(true).defaultTtl(600).build());

        assertThat(dto.getType()).isEqualTo("NAPTR");
        assertThat(dto.getDefaultTtl()).isEqualTo(600);
    }

    @Test
    void unknownTypeNameIsNotFound() {
        when(recordTypeRepository.findByTypeIgnoreCase("ZZ")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> recordTypeService.getRecordTypeEntity(" ZZ ")).isInstanceOf(ResourceNotFoundException.class);
    }
}

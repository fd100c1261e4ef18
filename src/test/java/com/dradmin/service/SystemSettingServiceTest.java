package com.dradmin.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.entity.SystemSetting;
import com.dradmin.repository.ISystemSettingRepo;

@ExtendWith(MockitoExtension.class)
class SystemSettingServiceTest {

    @Mock
    private ISystemSettingRepo settingRepo;

    @InjectMocks
    private SystemSettingService settingService;

    @Test
    void missingSequenceStartsAtDefault() {
        when(settingRepo.findByKeyForUpdate("INR")).thenReturn(Optional.empty());

        long value = settingService.nextSequenceValue("INR", 1L);

        ArgumentCaptor<SystemSetting> saved = ArgumentCaptor.forClass(SystemSetting.class);
        verify(settingRepo).save(saved.capture());
        assertThat(value).isEqualTo(1L);
        assertThat(saved.getValue().getKey()).isEqualTo("INR");
        assertThat(saved.getValue().getValue()).isEqualTo("2");
    }

    @Test
    void existingSequenceAdvances() {
        SystemSetting setting = SystemSetting.builder().key("CNR").value(" 1042 ").build();
        when(settingRepo.findByKeyForUpdate("CNR")).thenReturn(Optional.of(setting));

        assertThat(settingService.nextSequenceValue("CNR", 1001L)).isEqualTo(1042L);
        assertThat(setting.getValue()).isEqualTo("1043");
    }

    @Test
    void corruptSequenceIsReset() {
        SystemSetting setting = SystemSetting.builder().key("QNR").value("abc").build();
        when(settingRepo.findByKeyForUpdate("QNR")).thenReturn(Optional.of(setting));

        assertThat(settingService.nextSequenceValue("QNR", 1L)).isEqualTo(1L);
        assertThat(setting.getValue()).isEqualTo("2");
    }

    @Test
    void prefixIsOptional() {
        when(settingRepo.findByKey("CSX")).thenReturn(Optional.of(SystemSetting.builder().key("CSX").value("CS-").build()));
        when(settingRepo.findByKey("RSX")).thenReturn(Optional.empty());

        assertThat(settingService.formatWithPrefix("CSX", 1001L)).isEqualTo("CS-1001");
        assertThat(settingService.formatWithPrefix("RSX", 7L)).isEqualTo("7");
        assertThat(settingService.formatWithPrefix("RSX", null)).isNull();
        verify(settingRepo, never()).save(any());
    }

    @Test
    void emptySequenceIsReset() {
        SystemSetting setting = SystemSetting.builder().key("PNR").value(null).build();
        when(settingRepo.findByKeyForUpdate("PNR")).thenReturn(Optional.of(setting));

        assertThat(settingService.nextSequenceValue("PNR", 500L)).isEqualTo(500L);
        assertThat(setting.getValue()).isEqualTo("501");
    }
}

package com.dradmin.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.dto.SystemSettingDTO;
import com.dradmin.entity.SystemSetting;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.repository.ISystemSettingRepo;

import lombok.extern.slf4j.Slf4j;

/**
 * Key/value settings plus the numeric sequences stored in them.
 */
@Slf4j
@Service
@Transactional
public class SystemSettingService {

    public static final String CUSTOMER_REFERENCE_SEQUENCE = "PNR";
    public static final String CUSTOMER_REFERENCE_PREFIX = "RSX";
    public static final String CUSTOMER_NUMBER_SEQUENCE = "CNR";
    public static final String CUSTOMER_NUMBER_PREFIX = "CSX";
    public static final String INVOICE_SEQUENCE = "INR";
    public static final String QUOTE_SEQUENCE = "QNR";

    @Autowired
    private ISystemSettingRepo settingRepo;

    @Transactional(readOnly = true)
    public List<SystemSettingDTO> getAll() {
        return settingRepo.findAll().stream().map(SystemSettingDTO::fromEntity).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SystemSettingDTO getById(Long id) {
        return SystemSettingDTO.fromEntity(find(id));
    }

    @Transactional(readOnly = true)
    public SystemSettingDTO getByKey(String key) {
        return settingRepo.findByKey(key)
                .map(SystemSettingDTO::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("System setting not found with key: " + key));
    }

    @Transactional(readOnly = true)
    public String getValue(String key) {
        return settingRepo.findByKey(key).map(SystemSetting::getValue).orElse(null);
    }

    public SystemSettingDTO create(SystemSettingDTO dto) {
        if (settingRepo.existsByKey(dto.getKey())) {
            throw new BusinessRuleException("System setting already exists with key: " + dto.getKey());
        }
        SystemSetting setting = SystemSetting.builder()
                .key(dto.getKey())
                .value(dto.getValue())
                .description(dto.getDescription())
                .build();
        SystemSetting saved = settingRepo.save(setting);
        log.info("Created system setting {}", saved.getKey());
        return SystemSettingDTO.fromEntity(saved);
    }

    public SystemSettingDTO update(Long id, SystemSettingDTO dto) {
        SystemSetting setting = find(id);
        if (!setting.getKey().equals(dto.getKey()) && settingRepo.existsByKey(dto.getKey())) {
            throw new BusinessRuleException("System setting already exists with key: " + dto.getKey());
        }
        setting.setKey(dto.getKey());
        setting.setValue(dto.getValue());
        setting.setDescription(dto.getDescription());
        log.info("Updated system setting {}", setting.getKey());
        return SystemSettingDTO.fromEntity(settingRepo.save(setting));
    }

    public void delete(Long id) {
        SystemSetting setting = find(id);
        settingRepo.delete(setting);
        log.info("Deleted system setting {}", setting.getKey());
    }

    /**
     * Returns the current value of the sequence stored under {@code key} and advances it by one.
     * A missing row is created starting at {@code defaultStart}; a non-numeric value is reset to it.
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public long nextSequenceValue(String key, long defaultStart) {
        SystemSetting setting = settingRepo.findByKeyForUpdate(key).orElse(null);
        long current;
        if (setting == null) {
            current = defaultStart;
            setting = SystemSetting.builder()
                    .key(key)
                    .description("Sequence " + key)
                    .build();
        } else {
            current = parseSequence(key, setting.getValue(), defaultStart);
        }
        setting.setValue(String.valueOf(current + 1));
        settingRepo.save(setting);
        return current;
    }

    private static long parseSequence(String key, String value, long defaultStart) {
        if (value == null || value.isBlank()) {
            log.warn("Sequence {} has no value, resetting to {}", key, defaultStart);
            return defaultStart;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Sequence {} holds non-numeric value '{}', resetting to {}", key, value, defaultStart);
            return defaultStart;
        }
    }

    /**
     * Prefix stored under {@code prefixKey} followed by the number, or just the number when no prefix is set.
     */
    @Transactional(readOnly = true)
    public String formatWithPrefix(String prefixKey, Long number) {
        if (number == null) {
            return null;
        }
        String prefix = getValue(prefixKey);
        return (prefix == null ? "" : prefix) + number;
    }

    private SystemSetting find(Long id) {
        return settingRepo.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("System setting", id));
    }
}

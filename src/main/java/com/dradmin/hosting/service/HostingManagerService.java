package com.dradmin.hosting.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ExternalServiceException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.hosting.dto.HostingAccountDTO;
import com.dradmin.hosting.dto.ResourceUsageDTO;
import com.dradmin.hosting.dto.SyncComparisonDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.dto.SyncStatusDTO;
import com.dradmin.hosting.entity.HostingAccount;
import com.dradmin.hosting.entity.HostingAccount.AccountStatus;
import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.panel.HostingAccountResult;
import com.dradmin.hosting.panel.HostingPanelFactory;
import com.dradmin.hosting.repository.HostingAccountRepository;
import com.dradmin.service.CustomerService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class HostingManagerService {

    @Autowired
    private HostingAccountRepository accountRepository;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private ServerControlPanelService panelService;

    @Autowired
    private HostingSyncService syncService;

    @Autowired
    private HostingPanelFactory panelFactory;

    @Transactional(readOnly = true)
    public List<HostingAccountDTO> getAllAccounts() {
        return accountRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(HostingAccountDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<HostingAccountDTO> getAccountsByCustomer(Long customerId) {
        return accountRepository.findByCustomerIdOrderByCreatedAtDesc(customerId).stream()
                .map(HostingAccountDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<HostingAccountDTO> getAccountsByPanel(Long panelId) {
        return accountRepository.findByControlPanelIdOrderByUsernameAsc(panelId).stream()
                .map(HostingAccountDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public HostingAccountDTO getAccountById(Long id) {
        return HostingAccountDTO.fromEntity(find(id));
    }

    public HostingAccountDTO createAccount(HostingAccountDTO dto, boolean syncToServer) {
        HostingAccount account = new HostingAccount();
        account.setCustomer(customerService.getCustomerEntity(dto.getCustomerId()));
        if (dto.getControlPanelId() != null) {
            account.setControlPanel(panelService.getPanelEntity(dto.getControlPanelId()));
        }
        account.setExternalAccountId(dto.getExternalAccountId());
        account.setUsername(dto.getUsername());
        account.setPrimaryDomain(dto.getPrimaryDomain());
        account.setStatus(dto.getStatus() != null ? dto.getStatus() : AccountStatus.ACTIVE);
        applyLimits(account, dto);
        account.setSyncStatus(SyncStatus.NOT_SYNCED);
        HostingAccount saved = accountRepository.save(account);
        log.info("Created hosting account {} ({}) for customer {}", saved.getId(), saved.getUsername(),
                dto.getCustomerId());

        if (syncToServer && saved.getControlPanel() != null) {
            SyncResult result = syncService.pushToServer(saved, dto.getPassword());
            if (!result.isSuccess()) {
                log.warn("Hosting account {} saved but not provisioned: {}", saved.getId(), result.getMessage());
            }
        }
        return HostingAccountDTO.fromEntity(saved);
    }

    public HostingAccountDTO updateAccount(Long id, HostingAccountDTO dto, boolean syncToServer) {
        HostingAccount account = find(id);
        if (dto.getControlPanelId() != null) {
            account.setControlPanel(panelService.getPanelEntity(dto.getControlPanelId()));
        }
        if (dto.getPrimaryDomain() != null) {
            account.setPrimaryDomain(dto.getPrimaryDomain());
        }
        if (dto.getStatus() != null) {
            account.setStatus(dto.getStatus());
        }
        applyLimits(account, dto);
        HostingAccount saved = accountRepository.save(account);
        log.info("Updated hosting account {}", id);

        if (syncToServer && saved.getControlPanel() != null) {
            SyncResult result = syncService.pushToServer(saved, dto.getPassword());
            if (!result.isSuccess()) {
                log.warn("Hosting account {} updated locally only: {}", id, result.getMessage());
            }
        }
        return HostingAccountDTO.fromEntity(saved);
    }

    public void deleteAccount(Long id, boolean deleteFromServer) {
        HostingAccount account = find(id);
        if (deleteFromServer && account.getControlPanel() != null && account.getExternalAccountId() != null) {
            if (!syncService.deleteAccountFromServer(id)) {
                throw new ExternalServiceException("Could not delete hosting account " + id + " from its control panel");
            }
        }
        accountRepository.delete(account);
        log.info("Deleted hosting account {}", id);
    }

    public HostingAccountDTO suspendAccount(Long id, String reason) {
        HostingAccount account = find(id);
        if (account.getStatus() == AccountStatus.TERMINATED) {
            throw new BusinessRuleException("Terminated hosting accounts cannot be suspended");
        }
        if (hasRemote(account)) {
            HostingAccountResult result = panelFactory.create(account.getControlPanel())
                    .suspendAccount(account.getExternalAccountId(), reason);
            requireSuccess(result, "suspend");
        }
        account.setStatus(AccountStatus.SUSPENDED);
        log.info("Suspended hosting account {}: {}", id, reason);
        return HostingAccountDTO.fromEntity(accountRepository.save(account));
    }

    public HostingAccountDTO unsuspendAccount(Long id) {
        HostingAccount account = find(id);
        if (account.getStatus() != AccountStatus.SUSPENDED) {
            throw new BusinessRuleException("Hosting account " + id + " is not suspended");
        }
        if (hasRemote(account)) {
            requireSuccess(panelFactory.create(account.getControlPanel()).unsuspendAccount(account.getExternalAccountId()),
                    "unsuspend");
        }
        account.setStatus(AccountStatus.ACTIVE);
        log.info("Unsuspended hosting account {}", id);
        return HostingAccountDTO.fromEntity(accountRepository.save(account));
    }

    public SyncResult syncAccountFromServer(Long panelId, String externalAccountId) {
        return syncService.syncAccountFromServer(panelId, externalAccountId);
    }

    public SyncResult syncAccountToServer(Long id) {
        return syncService.syncAccountToServer(id);
    }

    public SyncResult syncAllAccountsFromServer(Long panelId) {
        return syncService.syncAllAccountsFromServer(panelId);
    }

    public SyncComparisonDTO compareWithServer(Long id) {
        return syncService.compareDatabaseWithServer(id);
    }

    @Transactional(readOnly = true)
    public SyncStatusDTO getSyncStatus(Long id) {
        HostingAccount account = find(id);
        return SyncStatusDTO.builder()
                .hostingAccountId(account.getId())
                .syncStatus(account.getSyncStatus())
                .externalAccountId(account.getExternalAccountId())
                .lastSyncedAt(account.getLastSyncedAt())
                .build();
    }

    @Transactional(readOnly = true)
    public ResourceUsageDTO getResourceUsage(Long id) {
        HostingAccount account = find(id);
        return ResourceUsageDTO.builder()
                .hostingAccountId(account.getId())
                .diskUsageMb(account.getDiskUsageMb())
                .diskQuotaMb(account.getDiskQuotaMb())
                .diskUsagePercent(percent(account.getDiskUsageMb(), account.getDiskQuotaMb()))
                .bandwidthUsageMb(account.getBandwidthUsageMb())
                .bandwidthLimitMb(account.getBandwidthLimitMb())
                .bandwidthUsagePercent(percent(account.getBandwidthUsageMb(), account.getBandwidthLimitMb()))
                .build();
    }

    static Double percent(Long used, Long limit) {
        if (used == null || limit == null || limit <= 0) {
            return null;
        }
        return BigDecimal.valueOf(used).multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(limit), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private boolean hasRemote(HostingAccount account) {
        return account.getControlPanel() != null && account.getExternalAccountId() != null
                && !account.getExternalAccountId().isBlank();
    }

    private void requireSuccess(HostingAccountResult result, String action) {
        if (!result.isSuccess()) {
            throw new ExternalServiceException("Control panel refused to " + action + " account: " + result.getMessage());
        }
    }

    private void applyLimits(HostingAccount account, HostingAccountDTO dto) {
        if (dto.getPlanName() != null) {
            account.setPlanName(dto.getPlanName());
        }
        if (dto.getDiskQuotaMb() != null) {
            account.setDiskQuotaMb(dto.getDiskQuotaMb());
        }
        if (dto.getBandwidthLimitMb() != null) {
            account.setBandwidthLimitMb(dto.getBandwidthLimitMb());
        }
        if (dto.getMaxEmailAccounts() != null) {
            account.setMaxEmailAccounts(dto.getMaxEmailAccounts());
        }
        if (dto.getMaxDatabases() != null) {
            account.setMaxDatabases(dto.getMaxDatabases());
        }
        if (dto.getMaxFtpAccounts() != null) {
            account.setMaxFtpAccounts(dto.getMaxFtpAccounts());
        }
        if (dto.getMaxSubdomains() != null) {
            account.setMaxSubdomains(dto.getMaxSubdomains());
        }
    }

    private HostingAccount find(Long id) {
        return accountRepository.findWithPanelById(id).orElseThrow(() -> new ResourceNotFoundException("HostingAccount", id));
    }
}

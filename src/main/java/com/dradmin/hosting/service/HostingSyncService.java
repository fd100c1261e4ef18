package com.dradmin.hosting.service;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.hosting.dto.SyncComparisonDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.entity.HostingAccount;
import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.entity.ServerControlPanel;
import com.dradmin.hosting.panel.HostingAccountRequest;
import com.dradmin.hosting.panel.HostingAccountResult;
import com.dradmin.hosting.panel.HostingPanel;
import com.dradmin.hosting.panel.HostingPanelFactory;
import com.dradmin.hosting.repository.HostingAccountRepository;
import com.dradmin.hosting.repository.ServerControlPanelRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves hosting account data between the database and the control panels.
 * <p>
 * Sync operations report problems in the returned {@link SyncResult} instead of throwing.
 */
@Slf4j
@Service
@Transactional
public class HostingSyncService {

    private static final int MAX_REPORTED_ERRORS = 5;
    private static final String PASSWORD_CHARS = "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789!@#%^*";

    private final SecureRandom random = new SecureRandom();

    @Autowired
    private ServerControlPanelRepository panelRepository;

    @Autowired
    private HostingAccountRepository accountRepository;

    @Autowired
    private HostingPanelFactory panelFactory;

    public SyncResult syncAccountFromServer(Long panelId, String externalAccountId) {
        try {
            log.info("Syncing account {} from control panel {}", externalAccountId, panelId);
            Optional<ServerControlPanel> controlPanel = panelRepository.findById(panelId);
            if (controlPanel.isEmpty()) {
                log.warn("Server control panel {} not found", panelId);
                return SyncResult.failed("Server control panel " + panelId + " not found");
            }

            HostingAccountResult info = panelFactory.create(controlPanel.get()).getAccountInfo(externalAccountId);
            if (!info.isSuccess()) {
                log.warn("Failed to get account info for {}: {}", externalAccountId, info.getMessage());
                return SyncResult.failed("Failed to get account info from server: " + info.getMessage());
            }

            Optional<HostingAccount> existing = accountRepository.findByControlPanelIdAndExternalAccountId(panelId,
                    externalAccountId);
            if (existing.isEmpty()) {
                return SyncResult.failed("Account " + externalAccountId + " not found in database");
            }

            HostingAccount account = existing.get();
            if (info.getUsername() != null) {
                account.setUsername(info.getUsername());
            }
            if (info.getStatus() != null) {
                account.setStatus(info.getStatus());
            }
            account.setDiskUsageMb(info.getDiskUsageMb());
            account.setDiskQuotaMb(info.getDiskQuotaMb());
            account.setBandwidthUsageMb(info.getBandwidthUsageMb());
            account.setBandwidthLimitMb(info.getBandwidthLimitMb());
            account.setLastSyncedAt(LocalDateTime.now());
            account.setSyncStatus(SyncStatus.SYNCED);
            accountRepository.save(account);

            log.info("Synced hosting account {} from server", account.getId());
            return SyncResult.ok("Successfully synced account " + externalAccountId, 1);
        } catch (RuntimeException e) {
            log.error("Error syncing account {} from control panel {}", externalAccountId, panelId, e);
            return SyncResult.failed("Error syncing account: " + e.getMessage());
        }
    }

    public SyncResult syncAccountToServer(Long accountId) {
        try {
            log.info("Syncing hosting account {} to server", accountId);
            Optional<HostingAccount> found = accountRepository.findWithPanelById(accountId);
            if (found.isEmpty()) {
                return SyncResult.failed("Hosting account " + accountId + " not found");
            }
            HostingAccount account = found.get();
            if (account.getControlPanel() == null) {
                return SyncResult.failed("No server control panel configured for this account");
            }
            return pushToServer(account, null);
        } catch (RuntimeException e) {
            log.error("Error syncing hosting account {} to server", accountId, e);
            return SyncResult.failed("Error syncing account to server: " + e.getMessage());
        }
    }

    /**
     * Creates the account on its panel when it has no external id yet, otherwise updates it.
     * A null password is replaced by a generated one on create.
     */
    public SyncResult pushToServer(HostingAccount account, String password) {
        boolean create = account.getExternalAccountId() == null || account.getExternalAccountId().isBlank();
        String action = create ? "create" : "update";

        HostingAccountResult result;
        try {
            HostingPanel panel = panelFactory.create(account.getControlPanel());
            HostingAccountRequest request = toRequest(account, password);
            if (create) {
                result = panel.createAccount(request);
                if (result.isSuccess()) {
                    account.setExternalAccountId(result.getAccountId() != null ? result.getAccountId() : account.getUsername());
                }
            } else {
                result = panel.updateAccount(account.getExternalAccountId(), request);
            }
        } catch (RuntimeException e) {
            log.error("Error during {} of hosting account {} on server", action, account.getId(), e);
            account.setSyncStatus(SyncStatus.ERROR);
            accountRepository.save(account);
            return SyncResult.failed("Error syncing account to server: " + e.getMessage());
        }

        if (!result.isSuccess()) {
            account.setSyncStatus(SyncStatus.ERROR);
            accountRepository.save(account);
            log.warn("Failed to {} hosting account {} on server: {}", action, account.getId(), result.getMessage());
            return SyncResult.failed("Failed to " + action + " account on server: " + result.getMessage());
        }

        account.setLastSyncedAt(LocalDateTime.now());
        account.setSyncStatus(SyncStatus.SYNCED);
        accountRepository.save(account);
        log.info("Synced hosting account {} to server ({})", account.getId(), action);
        return SyncResult.ok("Successfully synced account to server", 1);
    }

    public SyncResult syncAllAccountsFromServer(Long panelId) {
        try {
            log.info("Syncing all accounts from control panel {}", panelId);
            Optional<ServerControlPanel> controlPanel = panelRepository.findById(panelId);
            if (controlPanel.isEmpty()) {
                return SyncResult.failed("Server control panel " + panelId + " not found");
            }

            List<HostingAccountResult> remoteAccounts = panelFactory.create(controlPanel.get()).listAccounts();
            int synced = 0;
            List<String> errors = new ArrayList<>();
            for (HostingAccountResult remote : remoteAccounts) {
                if (remote.getUsername() == null || remote.getUsername().isBlank()) {
                    continue;
                }
                SyncResult one = syncAccountFromServer(panelId, remote.getUsername());
                if (one.isSuccess()) {
                    synced++;
                } else {
                    errors.add(remote.getUsername() + ": " + one.getMessage());
                }
            }

            StringBuilder message = new StringBuilder("Synced " + synced + " of " + remoteAccounts.size() + " accounts");
            if (!errors.isEmpty()) {
                message.append(". Errors: ")
                        .append(String.join("; ", errors.subList(0, Math.min(MAX_REPORTED_ERRORS, errors.size()))));
            }
            log.info("Finished syncing control panel {}: {} of {} accounts", panelId, synced, remoteAccounts.size());
            return SyncResult.builder()
                    .success(errors.size() < remoteAccounts.size())
                    .message(message.toString())
                    .recordsSynced(synced)
                    .build();
        } catch (RuntimeException e) {
            log.error("Error syncing all accounts from control panel {}", panelId, e);
            return SyncResult.failed("Error syncing accounts from server: " + e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public SyncComparisonDTO compareDatabaseWithServer(Long accountId) {
        SyncComparisonDTO comparison = SyncComparisonDTO.builder().hostingAccountId(accountId).build();
        try {
            Optional<HostingAccount> found = accountRepository.findWithPanelById(accountId);
            if (found.isEmpty() || found.get().getControlPanel() == null
                    || found.get().getExternalAccountId() == null) {
                comparison.getDifferences().add("Account not properly configured for sync");
                return comparison;
            }
            HostingAccount account = found.get();
            HostingAccountResult remote = panelFactory.create(account.getControlPanel())
                    .getAccountInfo(account.getExternalAccountId());
            if (!remote.isSuccess()) {
                comparison.getDifferences().add("Failed to get server account info: " + remote.getMessage());
                return comparison;
            }

            if (!Objects.equals(account.getDiskQuotaMb(), remote.getDiskQuotaMb())) {
                comparison.getDifferences().add(
                        "DiskQuota: DB=" + account.getDiskQuotaMb() + ", Server=" + remote.getDiskQuotaMb());
            }
            if (!Objects.equals(account.getBandwidthLimitMb(), remote.getBandwidthLimitMb())) {
                comparison.getDifferences().add(
                        "BandwidthLimit: DB=" + account.getBandwidthLimitMb() + ", Server=" + remote.getBandwidthLimitMb());
            }
            if (remote.getStatus() != null && account.getStatus() != remote.getStatus()) {
                comparison.getDifferences().add("Status: DB=" + account.getStatus() + ", Server=" + remote.getStatus());
            }
            comparison.setInSync(comparison.getDifferences().isEmpty());
            comparison.setLastChecked(LocalDateTime.now());
            return comparison;
        } catch (RuntimeException e) {
            log.error("Error comparing hosting account {} with server", accountId, e);
            comparison.setError(e.getMessage());
            comparison.getDifferences().add("Error during comparison: " + e.getMessage());
            return comparison;
        }
    }

    /**
     * @return true when the panel confirmed the removal
     */
    public boolean deleteAccountFromServer(Long accountId) {
        try {
            Optional<HostingAccount> found = accountRepository.findWithPanelById(accountId);
            if (found.isEmpty() || found.get().getControlPanel() == null
                    || found.get().getExternalAccountId() == null) {
                return false;
            }
            HostingAccount account = found.get();
            HostingAccountResult result = panelFactory.create(account.getControlPanel())
                    .deleteAccount(account.getExternalAccountId());
            if (!result.isSuccess()) {
                log.warn("Failed to delete hosting account {} from server: {}", accountId, result.getMessage());
                return false;
            }
            log.info("Deleted hosting account {} from server", accountId);
            return true;
        } catch (RuntimeException e) {
            log.error("Error deleting hosting account {} from server", accountId, e);
            return false;
        }
    }

    private HostingAccountRequest toRequest(HostingAccount account, String password) {
        String domain = account.getPrimaryDomain() != null ? account.getPrimaryDomain()
                : account.getUsername() + ".temp.local";
        return HostingAccountRequest.builder()
                .username(account.getUsername())
                .password(password != null ? password : generatePassword())
                .domain(domain)
                .contactEmail(account.getCustomer() != null ? account.getCustomer().getEmail() : null)
                .planName(account.getPlanName())
                .diskQuotaMb(account.getDiskQuotaMb())
                .bandwidthLimitMb(account.getBandwidthLimitMb())
                .maxEmailAccounts(account.getMaxEmailAccounts())
                .maxDatabases(account.getMaxDatabases())
                .maxFtpAccounts(account.getMaxFtpAccounts())
                .maxSubdomains(account.getMaxSubdomains())
                .build();
    }

    private String generatePassword() {
        StringBuilder sb = new StringBuilder(16);
        for (int i = 0; i < 16; i++) {
            sb.append(PASSWORD_CHARS.charAt(random.nextInt(PASSWORD_CHARS.length())));
        }
        return sb.toString();
    }
}

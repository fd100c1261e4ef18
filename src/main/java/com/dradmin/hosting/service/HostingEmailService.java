package com.dradmin.hosting.service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.hosting.dto.HostingEmailAccountDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.entity.HostingAccount;
import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.entity.HostingDomain;
import com.dradmin.hosting.entity.HostingEmailAccount;
import com.dradmin.hosting.panel.HostingPanel;
import com.dradmin.hosting.panel.HostingPanelFactory;
import com.dradmin.hosting.panel.PanelMailAccountInfo;
import com.dradmin.hosting.repository.HostingAccountRepository;
import com.dradmin.hosting.repository.HostingDomainRepository;
import com.dradmin.hosting.repository.HostingEmailAccountRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Mailboxes of hosting accounts, read per hosting domain from the control panel.
 */
@Slf4j
@Service
@Transactional
public class HostingEmailService {

    @Autowired
    private HostingEmailAccountRepository emailRepository;

    @Autowired
    private HostingDomainRepository domainRepository;

    @Autowired
    private HostingAccountRepository accountRepository;

    @Autowired
    private HostingPanelFactory panelFactory;

    @Transactional(readOnly = true)
    public List<HostingEmailAccountDTO> getEmailAccountsByAccount(Long hostingAccountId) {
        return emailRepository.findByHostingAccountIdOrderByEmailAddressAsc(hostingAccountId).stream()
                .map(HostingEmailAccountDTO::fromEntity)
                .collect(Collectors.toList());
    }

    /**
     * Mailboxes of a domain whose listing failed are left untouched.
     */
    public SyncResult syncEmailAccountsFromServer(Long hostingAccountId) {
        try {
            log.info("Syncing email accounts from server for hosting account {}", hostingAccountId);
            Optional<HostingAccount> found = accountRepository.findWithPanelById(hostingAccountId);
            if (found.isEmpty() || found.get().getControlPanel() == null) {
                return SyncResult.failed("Hosting account or server control panel not found");
            }
            HostingAccount account = found.get();
            List<HostingDomain> domains = domainRepository.findByHostingAccountIdOrderByDomainNameAsc(hostingAccountId);
            if (domains.isEmpty()) {
                return SyncResult.failed("No domains found for this hosting account");
            }

            HostingPanel panel = panelFactory.create(account.getControlPanel());
            Map<String, HostingEmailAccount> local = new LinkedHashMap<>();
            for (HostingEmailAccount mailbox : emailRepository.findByHostingAccountIdOrderByEmailAddressAsc(hostingAccountId)) {
                local.put(mailbox.getEmailAddress().toLowerCase(), mailbox);
            }

            Set<String> seen = new HashSet<>();
            Set<String> listedDomains = new HashSet<>();
            List<String> errors = new ArrayList<>();
            LocalDateTime now = LocalDateTime.now();
            int synced = 0;
            for (HostingDomain domain : domains) {
                List<PanelMailAccountInfo> remote;
                try {
                    remote = panel.listMailAccounts(account.getExternalAccountId(), domain.getDomainName());
                } catch (RuntimeException e) {
                    log.warn("Error syncing emails for domain {}: {}", domain.getDomainName(), e.getMessage());
                    errors.add("Domain " + domain.getDomainName() + ": " + e.getMessage());
                    continue;
                }
                listedDomains.add(domain.getDomainName().toLowerCase());
                for (PanelMailAccountInfo info : remote) {
                    String address = info.getEmailAddress().trim().toLowerCase();
                    if (!seen.add(address)) {
                        continue;
                    }
                    HostingEmailAccount mailbox = local.get(address);
                    if (mailbox == null) {
                        mailbox = HostingEmailAccount.builder()
                                .hostingAccount(account)
                                .emailAddress(address)
                                .username(address.substring(0, Math.max(0, address.indexOf('@'))))
                                .build();
                    }
                    mailbox.setQuotaMb(info.getQuotaMb());
                    mailbox.setUsageMb(info.getUsageMb());
                    mailbox.setLastSyncedAt(now);
                    mailbox.setSyncStatus(SyncStatus.SYNCED);
                    emailRepository.save(mailbox);
                    synced++;
                }
            }

            List<HostingEmailAccount> removed = local.entrySet().stream()
                    .filter(e -> !seen.contains(e.getKey()) && listedDomains.contains(e.getValue().getDomainPart()))
                    .map(Map.Entry::getValue)
                    .collect(Collectors.toList());
            if (!removed.isEmpty()) {
                emailRepository.deleteAll(removed);
            }

            log.info("Email sync completed for hosting account {}: {} synced, {} removed", hostingAccountId, synced,
                    removed.size());
            return SyncResult.builder()
                    .success(errors.isEmpty() || synced > 0)
                    .recordsSynced(synced)
                    .message(errors.isEmpty()
                            ? "Successfully synced " + synced + " email accounts"
                            : "Synced " + synced + " email accounts with errors: " + String.join("; ", errors))
                    .build();
        } catch (RuntimeException e) {
            log.error("Error syncing email accounts for hosting account {}", hostingAccountId, e);
            return SyncResult.failed("Error syncing email accounts: " + e.getMessage());
        }
    }
}

package com.dradmin.hosting.service;

import java.time.LocalDateTime;
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

import com.dradmin.hosting.dto.HostingDomainDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.entity.HostingAccount;
import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.entity.HostingDomain;
import com.dradmin.hosting.panel.HostingPanelFactory;
import com.dradmin.hosting.panel.PanelDomainInfo;
import com.dradmin.hosting.repository.HostingAccountRepository;
import com.dradmin.hosting.repository.HostingDomainRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Domains of hosting accounts. The panel is the source of truth: a sync adds and updates the
 * domains it reports and removes local ones it no longer lists.
 */
@Slf4j
@Service
@Transactional
public class HostingDomainService {

    @Autowired
    private HostingDomainRepository domainRepository;

    @Autowired
    private HostingAccountRepository accountRepository;

    @Autowired
    private HostingPanelFactory panelFactory;

    @Transactional(readOnly = true)
    public List<HostingDomainDTO> getDomainsByAccount(Long hostingAccountId) {
        return domainRepository.findByHostingAccountIdOrderByDomainNameAsc(hostingAccountId).stream()
                .map(HostingDomainDTO::fromEntity)
                .collect(Collectors.toList());
    }

    public SyncResult syncDomainsFromServer(Long hostingAccountId) {
        try {
            log.info("Syncing domains from server for hosting account {}", hostingAccountId);
            Optional<HostingAccount> found = accountRepository.findWithPanelById(hostingAccountId);
            if (found.isEmpty() || found.get().getControlPanel() == null) {
                return SyncResult.failed("Hosting account or server control panel not found");
            }
            HostingAccount account = found.get();
            if (account.getExternalAccountId() == null || account.getExternalAccountId().isBlank()) {
                return SyncResult.failed("Hosting account " + hostingAccountId + " does not exist on its control panel");
            }

            List<PanelDomainInfo> remote = panelFactory.create(account.getControlPanel())
                    .listDomains(account.getExternalAccountId());

            Map<String, HostingDomain> stale = new LinkedHashMap<>();
            for (HostingDomain domain : domainRepository.findByHostingAccountIdOrderByDomainNameAsc(hostingAccountId)) {
                stale.put(domain.getDomainName().toLowerCase(), domain);
            }
            Set<String> seen = new HashSet<>();
            LocalDateTime now = LocalDateTime.now();
            int synced = 0;
            for (PanelDomainInfo info : remote) {
                String name = info.getDomainName().trim().toLowerCase();
                if (!seen.add(name)) {
                    continue;
                }
                HostingDomain domain = stale.remove(name);
                if (domain == null) {
                    domain = HostingDomain.builder().hostingAccount(account).domainName(name).build();
                }
                domain.setDomainType(info.getDomainType());
                domain.setLastSyncedAt(now);
                domain.setSyncStatus(SyncStatus.SYNCED);
                domainRepository.save(domain);
                synced++;
            }
            if (!stale.isEmpty()) {
                log.info("Removing domains {} no longer present on the panel for hosting account {}",
                        stale.keySet(), hostingAccountId);
                domainRepository.deleteAll(stale.values());
            }

            log.info("Domain sync completed for hosting account {}: {} synced, {} removed", hostingAccountId,
                    synced, stale.size());
            return SyncResult.ok("Synced " + synced + " domains, removed " + stale.size(), synced);
        } catch (RuntimeException e) {
            log.error("Error syncing domains for hosting account {}", hostingAccountId, e);
            return SyncResult.failed("Error syncing domains: " + e.getMessage());
        }
    }
}

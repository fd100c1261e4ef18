package com.dradmin.hosting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.exception.ExternalServiceException;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.entity.HostingAccount;
import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.entity.HostingDomain;
import com.dradmin.hosting.entity.HostingDomain.DomainType;
import com.dradmin.hosting.entity.ServerControlPanel;
import com.dradmin.hosting.entity.ServerControlPanel.PanelType;
import com.dradmin.hosting.panel.HostingPanel;
import com.dradmin.hosting.panel.HostingPanelFactory;
import com.dradmin.hosting.panel.PanelDomainInfo;
import com.dradmin.hosting.repository.HostingAccountRepository;
import com.dradmin.hosting.repository.HostingDomainRepository;

@ExtendWith(MockitoExtension.class)
class HostingDomainServiceTest {

    @Mock
    private HostingDomainRepository domainRepository;

    @Mock
    private HostingAccountRepository accountRepository;

    @Mock
    private HostingPanelFactory panelFactory;

    @Mock
    private HostingPanel panel;

    @InjectMocks
    private HostingDomainService domainService;

    private ServerControlPanel controlPanel;
    private HostingAccount account;

    @BeforeEach
    void setUp() {
        controlPanel = ServerControlPanel.builder().id(1L).name("whm01").panelType(PanelType.CPANEL)
                .apiUrl("whm01.example.net").build();
        account = HostingAccount.builder().id(20L).controlPanel(controlPanel).username("kunde1")
                .externalAccountId("kunde1").build();
    }

    private static PanelDomainInfo remote(String name, DomainType type) {
        return PanelDomainInfo.builder().domainName(name).domainType(type).build();
    }

    @Test
    void syncAddsUpdatesAndRemovesDomains() {
        HostingDomain kept = HostingDomain.builder().id(1L).hostingAccount(account).domainName("kunde1.no")
                .domainType(DomainType.ADDON).build();
        HostingDomain gone = HostingDomain.builder().id(2L).hostingAccount(account).domainName("gammel.no")
                .domainType(DomainType.PARKED).build();
        when(accountRepository.findWithPanelById(20L)).thenReturn(Optional.of(account));
        when(panelFactory.create(controlPanel)).thenReturn(panel);
        when(panel.listDomains("kunde1")).thenReturn(List.of(
                remote("Kunde1.no", DomainType.MAIN),
                remote("butikk.no", DomainType.ADDON),
                remote("butikk.no", DomainType.ADDON)));
        when(domainRepository.findByHostingAccountIdOrderByDomainNameAsc(20L))
                .thenReturn(new ArrayList<>(List.of(gone, kept)));
        when(domainRepository.save(any(HostingDomain.class))).thenAnswer(i -> i.getArgument(0));

        SyncResult result = domainService.syncDomainsFromServer(20L);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRecordsSynced()).isEqualTo(2);
        assertThat(result.getMessage()).isEqualTo("Synced 2 domains, removed 1");
        assertThat(kept.getDomainType()).isEqualTo(DomainType.MAIN);
        assertThat(kept.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(kept.getLastSyncedAt()).isNotNull();

        ArgumentCaptor<HostingDomain> saved = ArgumentCaptor.forClass(HostingDomain.class);
        verify(domainRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(HostingDomain::getDomainName)
                .containsExactly("kunde1.no", "butikk.no");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<HostingDomain>> deleted = ArgumentCaptor.forClass(Collection.class);
        verify(domainRepository).deleteAll(deleted.capture());
        assertThat(deleted.getValue()).containsExactly(gone);
    }

    @Test
    void syncWithoutPanelFails() {
        account.setControlPanel(null);
        when(accountRepository.findWithPanelById(20L)).thenReturn(Optional.of(account));

        SyncResult result = domainService.syncDomainsFromServer(20L);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Hosting account or server control panel not found");
    }

    @Test
    void syncOfAccountNotOnPanelFails() {
        account.setExternalAccountId(null);
        when(accountRepository.findWithPanelById(20L)).thenReturn(Optional.of(account));

        SyncResult result = domainService.syncDomainsFromServer(20L);

        assertThat(result.isSuccess()).isFalse();
        verify(panelFactory, never()).create(any());
    }

    @Test
    void panelErrorLeavesLocalDomainsAlone() {
        when(accountRepository.findWithPanelById(20L)).thenReturn(Optional.of(account));
        when(panelFactory.create(controlPanel)).thenReturn(panel);
        when(panel.listDomains("kunde1"))
                .thenThrow(new ExternalServiceException("cPanel DomainInfo::list_domains failed: timeout"));

        SyncResult result = domainService.syncDomainsFromServer(20L);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage())
                .isEqualTo("Error syncing domains: cPanel DomainInfo::list_domains failed: timeout");
        verify(domainRepository, never()).deleteAll(anyCollection());
    }
}

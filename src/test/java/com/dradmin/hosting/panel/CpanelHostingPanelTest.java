package com.dradmin.hosting.panel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.dradmin.exception.ExternalServiceException;
import com.dradmin.hosting.entity.HostingAccount.AccountStatus;
import com.dradmin.hosting.entity.HostingDomain.DomainType;
import com.dradmin.hosting.entity.ServerControlPanel;
import com.dradmin.hosting.entity.ServerControlPanel.PanelType;

class CpanelHostingPanelTest {

    private static final String BASE = "https://whm01.example.net:2087/json-api/";

    private MockRestServiceServer server;
    private CpanelHostingPanel panel;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ServerControlPanel controlPanel = ServerControlPanel.builder()
                .id(1L).name("whm01").panelType(PanelType.CPANEL)
                .apiUrl("whm01.example.net/").apiToken("TOKEN123").build();
        panel = new CpanelHostingPanel(restTemplate, controlPanel);
    }

    @Test
    void baseUrlAddsSchemeAndPortOnlyWhenMissing() {
        ServerControlPanel bare = ServerControlPanel.builder().apiUrl("panel.example.net").port(2086).useHttps(false).build();
        ServerControlPanel full = ServerControlPanel.builder().apiUrl("https://panel.example.net:2087//").build();

        assertThat(CpanelHostingPanel.baseUrl(bare)).isEqualTo("http://panel.example.net:2086");
        assertThat(CpanelHostingPanel.baseUrl(full)).isEqualTo("https://panel.example.net:2087");
    }

    @Test
    void sizesAreConvertedToMegabytes() {
        assertThat(CpanelHostingPanel.sizeToMb("1024M")).isEqualTo(1024L);
        assertThat(CpanelHostingPanel.sizeToMb("2G")).isEqualTo(2048L);
        assertThat(CpanelHostingPanel.sizeToMb("512k")).isEqualTo(1L);
        assertThat(CpanelHostingPanel.sizeToMb("unlimited")).isNull();
        assertThat(CpanelHostingPanel.sizeToMb("n/a")).isNull();
    }

    @Test
    void createAccountSendsTokenAndParameters() {
        server.expect(requestTo(startsWith(BASE + "createacct")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "whm root:TOKEN123"))
                .andExpect(queryParam("username", "kunde1"))
                .andExpect(queryParam("quota", "1024"))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1,\"reason\":\"OK\"}}", MediaType.APPLICATION_JSON));

        HostingAccountResult result = panel.createAccount(HostingAccountRequest.builder()
                .username("kunde1").password("pw").domain("kunde1.no").diskQuotaMb(1024L).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAccountId()).isEqualTo("kunde1");
        assertThat(result.getStatus()).isEqualTo(AccountStatus.ACTIVE);
        server.verify();
    }

    @Test
    void failedWhmResultCarriesReason() {
        server.expect(requestTo(startsWith(BASE + "suspendacct")))
                .andRespond(withSuccess("{\"metadata\":{\"result\":0,\"reason\":\"User does not exist\"}}",
                        MediaType.APPLICATION_JSON));

        HostingAccountResult result = panel.suspendAccount("ukjent", "unpaid");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo("CPANEL_ERROR");
        assertThat(result.getMessage()).isEqualTo("User does not exist");
    }

    @Test
    void accountInfoCombinesSummaryAndBandwidth() {
        server.expect(requestTo(startsWith(BASE + "accountsummary")))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1},\"data\":{\"acct\":[{\"user\":\"kunde1\","
                        + "\"domain\":\"kunde1.no\",\"plan\":\"basic\",\"suspended\":1,\"diskused\":\"300M\","
                        + "\"disklimit\":\"1G\"}]}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "showbw")))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1},\"data\":{\"acct\":[{\"totalbytes\":10485760,"
                        + "\"limit\":\"unlimited\"}]}}", MediaType.APPLICATION_JSON));

        HostingAccountResult info = panel.getAccountInfo("kunde1");

        assertThat(info.isSuccess()).isTrue();
        assertThat(info.getStatus()).isEqualTo(AccountStatus.SUSPENDED);
        assertThat(info.getDiskUsageMb()).isEqualTo(300L);
        assertThat(info.getDiskQuotaMb()).isEqualTo(1024L);
        assertThat(info.getBandwidthUsageMb()).isEqualTo(10L);
        assertThat(info.getBandwidthLimitMb()).isNull();
        server.verify();
    }

    @Test
    void listAccountsReadsEveryEntry() {
        server.expect(requestTo(startsWith(BASE + "listaccts")))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1},\"data\":{\"acct\":[{\"user\":\"a1\"},{\"user\":\"b2\"}]}}",
                        MediaType.APPLICATION_JSON));

        List<HostingAccountResult> accounts = panel.listAccounts();

        assertThat(accounts).extracting(HostingAccountResult::getUsername).containsExactly("a1", "b2");
    }

    @Test
    void httpErrorBecomesExternalServiceException() {
        server.expect(requestTo(startsWith(BASE + "removeacct"))).andRespond(withServerError());

        assertThatThrownBy(() -> panel.deleteAccount("kunde1"))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageStartingWith("cPanel removeacct call failed");
    }

    @Test
    void listDomainsRunsUapiAsAccountUser() {
        server.expect(requestTo(startsWith(BASE + "uapi_cpanel")))
                .andExpect(queryParam("cpanel.user", "kunde1"))
                .andExpect(queryParam("cpanel.module", "DomainInfo"))
                .andExpect(queryParam("cpanel.function", "list_domains"))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1},\"data\":{\"uapi\":{\"status\":1,"
                        + "\"data\":{\"main_domain\":\"kunde1.no\",\"addon_domains\":[\"butikk.no\"],"
                        + "\"parked_domains\":[],\"sub_domains\":[\"blogg.kunde1.no\"]}}}}",
                        MediaType.APPLICATION_JSON));

        List<PanelDomainInfo> domains = panel.listDomains("kunde1");

        assertThat(domains).extracting(PanelDomainInfo::getDomainName)
                .containsExactly("kunde1.no", "butikk.no", "blogg.kunde1.no");
        assertThat(domains).extracting(PanelDomainInfo::getDomainType)
                .containsExactly(DomainType.MAIN, DomainType.ADDON, DomainType.SUBDOMAIN);
        server.verify();
    }

    @Test
    void listMailAccountsReadsQuotaAndUsage() {
        server.expect(requestTo(startsWith(BASE + "uapi_cpanel")))
                .andExpect(queryParam("cpanel.module", "Email"))
                .andExpect(queryParam("cpanel.function", "list_pops_with_disk"))
                .andExpect(queryParam("domain", "kunde1.no"))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1},\"data\":{\"uapi\":{\"status\":1,"
                        + "\"data\":[{\"email\":\"post@kunde1.no\",\"diskquota\":\"250\",\"diskused\":\"12\"},"
                        + "{\"email\":\"salg@kunde1.no\",\"diskquota\":\"unlimited\",\"diskused\":\"0\"}]}}}",
                        MediaType.APPLICATION_JSON));

        List<PanelMailAccountInfo> mailboxes = panel.listMailAccounts("kunde1", "kunde1.no");

        assertThat(mailboxes).hasSize(2);
        assertThat(mailboxes.get(0).getEmailAddress()).isEqualTo("post@kunde1.no");
        assertThat(mailboxes.get(0).getQuotaMb()).isEqualTo(250L);
        assertThat(mailboxes.get(0).getUsageMb()).isEqualTo(12L);
        assertThat(mailboxes.get(1).getQuotaMb()).isNull();
    }

    @Test
    void failedUapiStatusRaisesWithFirstError() {
        server.expect(requestTo(startsWith(BASE + "uapi_cpanel")))
                .andRespond(withSuccess("{\"metadata\":{\"result\":1},\"data\":{\"uapi\":{\"status\":0,"
                        + "\"errors\":[\"The domain does not belong to this account\"]}}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> panel.listMailAccounts("kunde1", "annen.no"))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("cPanel Email::list_pops_with_disk failed: The domain does not belong to this account");
    }
}

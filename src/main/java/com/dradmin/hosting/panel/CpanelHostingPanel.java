package com.dradmin.hosting.panel;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.dradmin.exception.ExternalServiceException;
import com.dradmin.hosting.entity.HostingAccount.AccountStatus;
import com.dradmin.hosting.entity.HostingDomain.DomainType;
import com.dradmin.hosting.entity.ServerControlPanel;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * WHM JSON API (version 1) client. Every call is a GET on {@code /json-api/<function>?api.version=1}
 * authenticated with an API token.
 */
@Slf4j
public class CpanelHostingPanel implements HostingPanel {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String authorization;

    public CpanelHostingPanel(RestTemplate restTemplate, ServerControlPanel panel) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl(panel);
        String user = panel.getUsername() == null || panel.getUsername().isBlank() ? "root" : panel.getUsername();
        this.authorization = "whm " + user + ":" + (panel.getApiToken() == null ? "" : panel.getApiToken());
    }

    static String baseUrl(ServerControlPanel panel) {
        String url = panel.getApiUrl().trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return (panel.isUseHttps() ? "https://" : "http://") + url + ":" + panel.getPort();
    }

    @Override
    public HostingAccountResult createAccount(HostingAccountRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("username", request.getUsername());
        params.put("domain", request.getDomain());
        params.put("password", request.getPassword());
        params.put("contactemail", request.getContactEmail());
        params.put("plan", request.getPlanName());
        params.put("quota", request.getDiskQuotaMb());
        params.put("bwlimit", request.getBandwidthLimitMb());
        params.put("maxpop", request.getMaxEmailAccounts());
        params.put("maxsql", request.getMaxDatabases());
        params.put("maxftp", request.getMaxFtpAccounts());
        params.put("maxsub", request.getMaxSubdomains());
        JsonNode response = call("createacct", params);
        HostingAccountResult result = resultOf(response, "Account created");
        if (result.isSuccess()) {
            result.setAccountId(request.getUsername());
            result.setUsername(request.getUsername());
            result.setDomain(request.getDomain());
            result.setStatus(AccountStatus.ACTIVE);
        }
        return result;
    }

    @Override
    public HostingAccountResult updateAccount(String externalAccountId, HostingAccountRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("user", externalAccountId);
        params.put("DNS", request.getDomain());
        params.put("BWLIMIT", request.getBandwidthLimitMb());
        params.put("MAXPOP", request.getMaxEmailAccounts());
        params.put("MAXSQL", request.getMaxDatabases());
        params.put("MAXFTP", request.getMaxFtpAccounts());
        params.put("MAXSUB", request.getMaxSubdomains());
        HostingAccountResult result = resultOf(call("modifyacct", params), "Account updated");
        if (result.isSuccess() && request.getDiskQuotaMb() != null) {
            Map<String, Object> quota = new LinkedHashMap<>();
            quota.put("user", externalAccountId);
            quota.put("quota", request.getDiskQuotaMb());
            result = resultOf(call("editquota", quota), "Account updated");
        }
        result.setAccountId(externalAccountId);
        return result;
    }

    @Override
    public HostingAccountResult suspendAccount(String externalAccountId, String reason) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("user", externalAccountId);
        params.put("reason", reason);
        HostingAccountResult result = resultOf(call("suspendacct", params), "Account suspended");
        result.setAccountId(externalAccountId);
        return result;
    }

    @Override
    public HostingAccountResult unsuspendAccount(String externalAccountId) {
        HostingAccountResult result = resultOf(call("unsuspendacct", Map.of("user", externalAccountId)), "Account unsuspended");
        result.setAccountId(externalAccountId);
        return result;
    }

    @Override
    public HostingAccountResult deleteAccount(String externalAccountId) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("username", externalAccountId);
        HostingAccountResult result = resultOf(call("removeacct", params), "Account removed");
        result.setAccountId(externalAccountId);
        return result;
    }

    @Override
    public HostingAccountResult getAccountInfo(String externalAccountId) {
        JsonNode response = call("accountsummary", Map.of("user", externalAccountId));
        HostingAccountResult result = resultOf(response, "Account found");
        if (!result.isSuccess()) {
            return result;
        }
        JsonNode accounts = response.path("data").path("acct");
        if (!accounts.isArray() || accounts.isEmpty()) {
            return HostingAccountResult.failure("NOT_FOUND", "Account " + externalAccountId + " not found on server");
        }
        HostingAccountResult info = fromAccountNode(accounts.get(0));
        info.setMessage(result.getMessage());
        readBandwidth(externalAccountId, info);
        return info;
    }

    @Override
    public List<HostingAccountResult> listAccounts() {
        JsonNode response = call("listaccts", Map.of());
        HostingAccountResult status = resultOf(response, "OK");
        if (!status.isSuccess()) {
            throw new ExternalServiceException("cPanel listaccts failed: " + status.getMessage());
        }
        List<HostingAccountResult> accounts = new ArrayList<>();
        for (JsonNode node : response.path("data").path("acct")) {
            accounts.add(fromAccountNode(node));
        }
        return accounts;
    }

    @Override
    public List<PanelDomainInfo> listDomains(String externalAccountId) {
        JsonNode data = uapi(externalAccountId, "DomainInfo", "list_domains", Map.of());
        List<PanelDomainInfo> domains = new ArrayList<>();
        String main = data.path("main_domain").asText(null);
        if (main != null && !main.isBlank()) {
            domains.add(PanelDomainInfo.builder().domainName(main).domainType(DomainType.MAIN).build());
        }
        addDomains(domains, data.path("addon_domains"), DomainType.ADDON);
        addDomains(domains, data.path("parked_domains"), DomainType.PARKED);
        addDomains(domains, data.path("sub_domains"), DomainType.SUBDOMAIN);
        return domains;
    }

    @Override
    public List<PanelMailAccountInfo> listMailAccounts(String externalAccountId, String domain) {
        JsonNode data = uapi(externalAccountId, "Email", "list_pops_with_disk", Map.of("domain", domain));
        List<PanelMailAccountInfo> mailboxes = new ArrayList<>();
        for (JsonNode node : data) {
            String email = node.path("email").asText(null);
            if (email == null || email.isBlank()) {
                continue;
            }
            mailboxes.add(PanelMailAccountInfo.builder()
                    .emailAddress(email)
                    .quotaMb(sizeToMb(node.path("diskquota").asText(null)))
                    .usageMb(sizeToMb(node.path("diskused").asText(null)))
                    .build());
        }
        return mailboxes;
    }

    private static void addDomains(List<PanelDomainInfo> domains, JsonNode names, DomainType type) {
        for (JsonNode name : names) {
            if (!name.asText("").isBlank()) {
                domains.add(PanelDomainInfo.builder().domainName(name.asText()).domainType(type).build());
            }
        }
    }

    /**
     * cPanel UAPI function run as {@code user} through WHM's {@code uapi_cpanel}; returns the UAPI data node.
     */
    private JsonNode uapi(String user, String module, String function, Map<String, ?> args) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("cpanel.user", user);
        params.put("cpanel.module", module);
        params.put("cpanel.function", function);
        params.putAll(args);
        JsonNode response = call("uapi_cpanel", params);
        HostingAccountResult status = resultOf(response, "OK");
        if (!status.isSuccess()) {
            throw new ExternalServiceException("cPanel " + module + "::" + function + " failed: " + status.getMessage());
        }
        JsonNode uapi = response.path("data").path("uapi");
        if (uapi.path("status").asInt(0) != 1) {
            JsonNode errors = uapi.path("errors");
            String reason = errors.isArray() && !errors.isEmpty() ? errors.get(0).asText() : "Unknown cPanel error";
            throw new ExternalServiceException("cPanel " + module + "::" + function + " failed: " + reason);
        }
        return uapi.path("data");
    }

    private void readBandwidth(String user, HostingAccountResult info) {
        try {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("searchtype", "user");
            params.put("search", user);
            JsonNode response = call("showbw", params);
            JsonNode acct = response.path("data").path("acct");
            if (acct.isArray() && !acct.isEmpty()) {
                JsonNode usage = acct.get(0);
                info.setBandwidthUsageMb(bytesToMb(usage.path("totalbytes")));
                info.setBandwidthLimitMb(limitToMb(usage.path("limit")));
            }
        } catch (ExternalServiceException e) {
            log.warn("Could not read bandwidth for {}: {}", user, e.getMessage());
        }
    }

    private HostingAccountResult fromAccountNode(JsonNode node) {
        return HostingAccountResult.builder()
                .success(true)
                .accountId(node.path("user").asText(null))
                .username(node.path("user").asText(null))
                .domain(node.path("domain").asText(null))
                .planName(node.path("plan").asText(null))
                .status(node.path("suspended").asInt(0) == 1 ? AccountStatus.SUSPENDED : AccountStatus.ACTIVE)
                .diskUsageMb(sizeToMb(node.path("diskused").asText(null)))
                .diskQuotaMb(sizeToMb(node.path("disklimit").asText(null)))
                .build();
    }

    private HostingAccountResult resultOf(JsonNode response, String successMessage) {
        JsonNode metadata = response.path("metadata");
        if (metadata.path("result").asInt(0) == 1) {
            return HostingAccountResult.ok(successMessage);
        }
        String reason = metadata.path("reason").asText("Unknown cPanel error");
        return HostingAccountResult.failure("CPANEL_ERROR", reason);
    }

    private JsonNode call(String function, Map<String, ?> params) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/json-api/" + function)
                .queryParam("api.version", 1);
        params.forEach((key, value) -> {
            if (value != null) {
                uri.queryParam(key, value);
            }
        });

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, authorization);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Void> entity = new HttpEntity<>(headers);

        try {
            URI target = uri.encode().build().toUri();
            ResponseEntity<JsonNode> response = restTemplate.exchange(target, HttpMethod.GET, entity, JsonNode.class);
            if (response.getBody() == null) {
                throw new ExternalServiceException("Empty response from cPanel " + function);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new ExternalServiceException("cPanel " + function + " call failed: " + e.getMessage(), e);
        }
    }

    /**
     * WHM reports sizes like "1024M"; "unlimited" maps to null.
     */
    static Long sizeToMb(String value) {
        if (value == null || value.isBlank() || "unlimited".equalsIgnoreCase(value.trim())) {
            return null;
        }
        String v = value.trim().toUpperCase();
        double multiplier = 1;
        if (v.endsWith("G")) {
            multiplier = 1024;
            v = v.substring(0, v.length() - 1);
        } else if (v.endsWith("M")) {
            v = v.substring(0, v.length() - 1);
        } else if (v.endsWith("K")) {
            multiplier = 1.0 / 1024;
            v = v.substring(0, v.length() - 1);
        }
        try {
            return Math.round(Double.parseDouble(v) * multiplier);
        } catch (NumberFormatException e) {
            log.debug("Unparseable cPanel size '{}'", value);
            return null;
        }
    }

    private static Long bytesToMb(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asLong() / (1024 * 1024);
    }

    private static Long limitToMb(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || "unlimited".equalsIgnoreCase(node.asText())) {
            return null;
        }
        long bytes = node.asLong();
        return bytes <= 0 ? null : bytes / (1024 * 1024);
    }
}

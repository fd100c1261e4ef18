package com.dradmin.hosting.panel;

import java.util.List;

/**
 * Account operations of a hosting control panel. Calls report failures in the returned result;
 * transport errors surface as {@link com.dradmin.exception.ExternalServiceException}.
 */
public interface HostingPanel {

    HostingAccountResult createAccount(HostingAccountRequest request);

    HostingAccountResult updateAccount(String externalAccountId, HostingAccountRequest request);

    HostingAccountResult suspendAccount(String externalAccountId, String reason);

    HostingAccountResult unsuspendAccount(String externalAccountId);

    HostingAccountResult deleteAccount(String externalAccountId);

    HostingAccountResult getAccountInfo(String externalAccountId);

    List<HostingAccountResult> listAccounts();

    /**
     * Main, addon, parked and sub domains of the account.
     */
    List<PanelDomainInfo> listDomains(String externalAccountId);

    List<PanelMailAccountInfo> listMailAccounts(String externalAccountId, String domain);
}

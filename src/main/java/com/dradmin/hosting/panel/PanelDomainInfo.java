package com.dradmin.hosting.panel;

import com.dradmin.hosting.entity.HostingDomain.DomainType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PanelDomainInfo {
    private String domainName;
    private DomainType domainType;
}

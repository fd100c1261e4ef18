package com.dradmin.hosting.panel;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import com.dradmin.exception.NotImplementedFeatureException;
import com.dradmin.hosting.entity.ServerControlPanel;

@Component
public class HostingPanelFactory {

    @Autowired
    private RestTemplate restTemplate;

    public HostingPanel create(ServerControlPanel panel) {
        switch (panel.getPanelType()) {
            case CPANEL:
                return new CpanelHostingPanel(restTemplate, panel);
            default:
                throw new NotImplementedFeatureException(panel.getPanelType() + " hosting panel");
        }
    }
}

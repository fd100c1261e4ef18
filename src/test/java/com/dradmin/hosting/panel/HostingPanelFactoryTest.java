package com.dradmin.hosting.panel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import com.dradmin.exception.NotImplementedFeatureException;
import com.dradmin.hosting.entity.ServerControlPanel;
import com.dradmin.hosting.entity.ServerControlPanel.PanelType;

@ExtendWith(MockitoExtension.class)
class HostingPanelFactoryTest {

    @Mock
    private RestTemplate restTemplate;

    @InjectMocks
    private HostingPanelFactory factory;

    @Test
    void cpanelIsSupported() {
        ServerControlPanel panel = ServerControlPanel.builder().panelType(PanelType.CPANEL).apiUrl("whm.example.net").build();

        assertThat(factory.create(panel)).isInstanceOf(CpanelHostingPanel.class);
    }

    @Test
    void otherPanelsAreNotImplemented() {
        ServerControlPanel panel = ServerControlPanel.builder().panelType(PanelType.PLESK).apiUrl("plesk.example.net").build();

        assertThatThrownBy(() -> factory.create(panel)).isInstanceOf(NotImplementedFeatureException.class);
    }
}

package com.dradmin.hosting.controller;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.dradmin.exception.ExternalServiceException;
import com.dradmin.exception.GlobalExceptionHandler;
import com.dradmin.exception.NotImplementedFeatureException;
import com.dradmin.hosting.dto.HostingAccountDTO;
import com.dradmin.hosting.dto.HostingDomainDTO;
import com.dradmin.hosting.entity.HostingAccount.AccountStatus;
import com.dradmin.hosting.entity.HostingDomain.DomainType;
import com.dradmin.hosting.service.HostingDomainService;
import com.dradmin.hosting.service.HostingManagerService;

@ExtendWith(MockitoExtension.class)
class HostingAccountControllerTest {

    @Mock
    private HostingManagerService hostingManagerService;

    @Mock
    private HostingDomainService hostingDomainService;

    @InjectMocks
    private HostingAccountController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void suspendWithoutBodyUsesDefaultReason() throws Exception {
        when(hostingManagerService.suspendAccount(eq(3L), eq("Suspended by administrator")))
                .thenReturn(HostingAccountDTO.builder().id(3L).status(AccountStatus.SUSPENDED).build());

        mockMvc.perform(post("/api/hosting-accounts/3/suspend"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUSPENDED"));
    }

    @Test
    void suspendPassesGivenReason() throws Exception {
        when(hostingManagerService.suspendAccount(3L, "abuse"))
                .thenReturn(HostingAccountDTO.builder().id(3L).status(AccountStatus.SUSPENDED).build());

        mockMvc.perform(post("/api/hosting-accounts/3/suspend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"abuse\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void panelFailureIsBadGateway() throws Exception {
        doThrow(new ExternalServiceException("Could not delete hosting account 4 from its control panel"))
                .when(hostingManagerService).deleteAccount(4L, true);

        mockMvc.perform(delete("/api/hosting-accounts/4").param("deleteFromServer", "true"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("External Service Error"));
    }

    @Test
    void unsupportedPanelIsNotImplemented() throws Exception {
        when(hostingManagerService.unsuspendAccount(5L)).thenThrow(new NotImplementedFeatureException("PLESK hosting panel"));

        mockMvc.perform(post("/api/hosting-accounts/5/unsuspend"))
                .andExpect(status().isNotImplemented());
    }

    @Test
    void localDeleteIsDefault() throws Exception {
        mockMvc.perform(delete("/api/hosting-accounts/6")).andExpect(status().isNoContent());

        verify(hostingManagerService).deleteAccount(6L, false);
    }

    @Test
    void listsMirroredDomains() throws Exception {
        when(hostingDomainService.getDomainsByAccount(5L)).thenReturn(List.of(
                HostingDomainDTO.builder().id(1L).hostingAccountId(5L).domainName("kunde1.no")
                        .domainType(DomainType.MAIN).build()));

        mockMvc.perform(get("/api/hosting-accounts/5/domains"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].domainName").value("kunde1.no"))
                .andExpect(jsonPath("$[0].domainType").value("MAIN"));
    }
}

package com.dradmin.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import com.dradmin.dto.CustomerDTO;
import com.dradmin.dto.CustomerRequestDTO;
import com.dradmin.dto.PagedResult;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.repository.ICustomerRepo;

@ExtendWith(MockitoExtension.class)
class CustomerServiceTest {

    @Mock
    private ICustomerRepo customerRepo;

    @Mock
    private SystemSettingService settingService;

    @InjectMocks
    private CustomerService customerService;

    @BeforeEach
    void setUp() {
        lenient().when(settingService.formatWithPrefix(eq(SystemSettingService.CUSTOMER_REFERENCE_PREFIX), any()))
                .thenAnswer(inv -> inv.getArgument(1) == null ? null : "RSX" + inv.getArgument(1));
        lenient().when(settingService.formatWithPrefix(eq(SystemSettingService.CUSTOMER_NUMBER_PREFIX), any()))
                .thenAnswer(inv -> inv.getArgument(1) == null ? null : "CSX" + inv.getArgument(1));
    }

    private static CustomerRequestDTO request(String email) {
        CustomerRequestDTO request = new CustomerRequestDTO();
        request.setName("  Initech ");
        request.setEmail(email);
        request.setCountryCode("se");
        return request;
    }

    @Test
    void createAssignsReferenceNumberAndNormalizes() {
        when(customerRepo.emailInUse("Billing@Initech.test", null)).thenReturn(false);
        when(settingService.nextSequenceValue(SystemSettingService.CUSTOMER_REFERENCE_SEQUENCE,
                CustomerService.DEFAULT_SEQUENCE_START)).thenReturn(1001L);
        when(customerRepo.save(any(Customer.class))).thenAnswer(inv -> inv.getArgument(0));

        CustomerDTO created = customerService.createCustomer(request("Billing@Initech.test"));

        assertThat(created.getName()).isEqualTo("Initech");
        assertThat(created.getEmail()).isEqualTo("billing@initech.test");
        assertThat(created.getCountryCode()).isEqualTo("SE");
        assertThat(created.getFormattedReferenceNumber()).isEqualTo("RSX1001");
        assertThat(created.getFormattedCustomerNumber()).isNull();
        assertThat(created.getBalance()).isEqualByComparingTo("0");
    }

    @Test
    void duplicateEmailIsRejected() {
        when(customerRepo.emailInUse("taken@initech.test", null)).thenReturn(true);

        assertThatThrownBy(() -> customerService.createCustomer(request("taken@initech.test")))
                .isInstanceOf(BusinessRuleException.class);
        verify(customerRepo, never()).save(any());
    }

    @Test
    void customerNumberIsAssignedOnlyOnce() {
        Customer customer = Customer.builder().id(3L).name("Initech").balance(BigDecimal.ZERO).build();
        when(settingService.nextSequenceValue(SystemSettingService.CUSTOMER_NUMBER_SEQUENCE,
                CustomerService.DEFAULT_SEQUENCE_START)).thenReturn(1005L);
        when(customerRepo.save(customer)).thenReturn(customer);

        customerService.ensureCustomerNumber(customer);
        customerService.ensureCustomerNumber(customer);

        assertThat(customer.getCustomerNumber()).isEqualTo(1005L);
        verify(customerRepo).save(customer);
    }

    @Test
    void pagingIsOneBased() {
        Pageable firstPage = PageRequest.of(0, 2);
        when(customerRepo.findAllByOrderByNameAsc(firstPage)).thenReturn(new PageImpl<>(
                List.of(Customer.builder().id(1L).name("A").build(), Customer.builder().id(2L).name("B").build()),
                firstPage, 5));

        PagedResult<CustomerDTO> page = customerService.getCustomersPaged(1, 2);

        assertThat(page.getPage()).isEqualTo(1);
        assertThat(page.getTotalCount()).isEqualTo(5);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getItems()).hasSize(2);
    }

    @Test
    void invalidPagingIsRejected() {
        assertThatThrownBy(() -> customerService.getCustomersPaged(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> customerService.getCustomersPaged(1, 501)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownCustomerIsNotFound() {
        when(customerRepo.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> customerService.getCustomerById(9L)).isInstanceOf(ResourceNotFoundException.class);
    }
}

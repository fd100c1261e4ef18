package com.dradmin.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.dto.CustomerDTO;
import com.dradmin.dto.CustomerRequestDTO;
import com.dradmin.dto.PagedResult;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.repository.ICustomerRepo;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class CustomerService {

    static final long DEFAULT_SEQUENCE_START = 1001L;

    @Autowired
    private ICustomerRepo customerRepo;

    @Autowired
    private SystemSettingService settingService;

    @Transactional(readOnly = true)
    public List<CustomerDTO> getAllCustomers() {
        log.info("Fetching all customers");
        return customerRepo.findAllByOrderByNameAsc().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PagedResult<CustomerDTO> getCustomersPaged(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be 1 or greater");
        }
        if (pageSize < 1 || pageSize > 500) {
            throw new IllegalArgumentException("Page size must be between 1 and 500");
        }
        return PagedResult.of(customerRepo.findAllByOrderByNameAsc(PageRequest.of(page - 1, pageSize)), this::toDto);
    }

    @Transactional(readOnly = true)
    public CustomerDTO getCustomerById(Long id) {
        return toDto(getCustomerEntity(id));
    }

    @Transactional(readOnly = true)
    public Customer getCustomerEntity(Long id) {
        return customerRepo.findById(id)
                .orElseThrow(() -> {
                    log.warn("Customer with ID {} not found", id);
                    return new ResourceNotFoundException("Customer", id);
                });
    }

    /**
     * Looks a customer up by primary or billing email.
     */
    @Transactional(readOnly = true)
    public CustomerDTO getCustomerByEmail(String email) {
        return customerRepo.findByEmailOrBillingEmail(email).stream()
                .findFirst()
                .map(this::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found with email: " + email));
    }

    @Transactional(readOnly = true)
    public boolean checkEmailExists(String email) {
        return customerRepo.emailInUse(email, null);
    }

    public CustomerDTO createCustomer(CustomerRequestDTO request) {
        log.info("Creating customer with email {}", request.getEmail());
        if (customerRepo.emailInUse(request.getEmail(), null)) {
            throw new BusinessRuleException("A customer with email " + request.getEmail() + " already exists");
        }
        Customer customer = new Customer();
        apply(customer, request);
        customer.setBalance(BigDecimal.ZERO);
        customer.setReferenceNumber(settingService.nextSequenceValue(
                SystemSettingService.CUSTOMER_REFERENCE_SEQUENCE, DEFAULT_SEQUENCE_START));
        Customer saved = customerRepo.save(customer);
        log.info("Created customer {} with reference number {}", saved.getId(), saved.getReferenceNumber());
        return toDto(saved);
    }

    public CustomerDTO updateCustomer(Long id, CustomerRequestDTO request) {
        Customer customer = getCustomerEntity(id);
        if (customerRepo.emailInUse(request.getEmail(), id)) {
            throw new BusinessRuleException("A customer with email " + request.getEmail() + " already exists");
        }
        apply(customer, request);
        log.info("Updated customer {}", id);
        return toDto(customerRepo.save(customer));
    }

    public void deleteCustomer(Long id) {
        Customer customer = getCustomerEntity(id);
        customerRepo.delete(customer);
        log.info("Deleted customer {}", id);
    }

    /**
     * Gives the customer a customer number if it has none yet. Called when the first invoice is issued.
     */
    public Customer ensureCustomerNumber(Customer customer) {
        if (customer.getCustomerNumber() == null) {
            customer.setCustomerNumber(settingService.nextSequenceValue(
                    SystemSettingService.CUSTOMER_NUMBER_SEQUENCE, DEFAULT_SEQUENCE_START));
            customer = customerRepo.save(customer);
            log.info("Assigned customer number {} to customer {}", customer.getCustomerNumber(), customer.getId());
        }
        return customer;
    }

    private void apply(Customer customer, CustomerRequestDTO request) {
        customer.setName(request.getName().trim());
        customer.setEmail(request.getEmail().trim().toLowerCase());
        customer.setPhone(request.getPhone());
        customer.setCustomerName(request.getCustomerName());
        customer.setTaxId(request.getTaxId());
        customer.setVatNumber(request.getVatNumber());
        customer.setCountryCode(request.getCountryCode() != null ? request.getCountryCode().toUpperCase() : null);
        customer.setStateCode(request.getStateCode());
        customer.setCompany(request.isCompany());
        if (request.getActive() != null) {
            customer.setActive(request.getActive());
        }
        if (request.getStatus() != null) {
            customer.setStatus(request.getStatus());
        }
        customer.setCreditLimit(request.getCreditLimit() != null ? request.getCreditLimit() : BigDecimal.ZERO);
        customer.setNotes(request.getNotes());
        customer.setBillingEmail(request.getBillingEmail());
        customer.setPreferredPaymentMethod(request.getPreferredPaymentMethod());
        customer.setPreferredCurrency(request.getPreferredCurrency() != null
                ? request.getPreferredCurrency().toUpperCase() : "EUR");
        customer.setAllowCurrencyOverride(request.isAllowCurrencyOverride());
    }

    private CustomerDTO toDto(Customer customer) {
        CustomerDTO dto = CustomerDTO.fromEntity(customer);
        dto.setFormattedReferenceNumber(settingService.formatWithPrefix(
                SystemSettingService.CUSTOMER_REFERENCE_PREFIX, customer.getReferenceNumber()));
        dto.setFormattedCustomerNumber(settingService.formatWithPrefix(
                SystemSettingService.CUSTOMER_NUMBER_PREFIX, customer.getCustomerNumber()));
        return dto;
    }
}

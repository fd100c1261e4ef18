package com.dradmin.billing.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.TaxRule;

@Repository
public interface TaxRuleRepository extends JpaRepository<TaxRule, Long> {

    List<TaxRule> findAllByOrderByCountryCodeAscPriorityDesc();

    List<TaxRule> findByActiveTrueOrderByCountryCodeAscPriorityDesc();

    List<TaxRule> findByCountryCodeIgnoreCaseAndActiveTrue(String countryCode);

    List<TaxRule> findByCountryCodeIgnoreCase(String countryCode);
}

package com.dradmin.hosting.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.hosting.entity.HostingDomain;

@Repository
public interface HostingDomainRepository extends JpaRepository<HostingDomain, Long> {

    List<HostingDomain> findByHostingAccountIdOrderByDomainNameAsc(Long hostingAccountId);
}

package com.dradmin.hosting.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.hosting.entity.HostingEmailAccount;

@Repository
public interface HostingEmailAccountRepository extends JpaRepository<HostingEmailAccount, Long> {

    List<HostingEmailAccount> findByHostingAccountIdOrderByEmailAddressAsc(Long hostingAccountId);
}

package com.dradmin.hosting.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.hosting.entity.HostingAccount;

@Repository
public interface HostingAccountRepository extends JpaRepository<HostingAccount, Long> {

    @EntityGraph(attributePaths = {"customer", "controlPanel"})
    @Query("SELECT h FROM HostingAccount h WHERE h.id = :id")
    Optional<HostingAccount> findWithPanelById(@Param("id") Long id);

    List<HostingAccount> findAllByOrderByCreatedAtDesc();

    List<HostingAccount> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<HostingAccount> findByControlPanelIdOrderByUsernameAsc(Long controlPanelId);

    Optional<HostingAccount> findByControlPanelIdAndExternalAccountId(Long controlPanelId, String externalAccountId);
}

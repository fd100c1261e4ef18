package com.dradmin.dns.repository;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.dns.entity.DnsRecord;

@Repository
public interface DnsRecordRepository extends JpaRepository<DnsRecord, Long> {

    List<DnsRecord> findByDeletedFalseOrderByIdAsc();

    Page<DnsRecord> findByDeletedFalse(Pageable pageable);

    List<DnsRecord> findByDomainIdAndDeletedFalseOrderByIdAsc(Long domainId);

    @Query("SELECT r FROM DnsRecord r WHERE UPPER(r.type.type) = UPPER(:type) AND r.deleted = false ORDER BY r.id")
    List<DnsRecord> findActiveByTypeName(@Param("type") String type);

    List<DnsRecord> findByDomainIdAndPendingSyncTrueOrderByIdAsc(Long domainId);

    List<DnsRecord> findByDomainIdAndDeletedTrueOrderByIdAsc(Long domainId);
}

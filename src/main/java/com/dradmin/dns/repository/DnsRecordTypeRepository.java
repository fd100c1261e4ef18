package com.dradmin.dns.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.dns.entity.DnsRecordType;

@Repository
public interface DnsRecordTypeRepository extends JpaRepository<DnsRecordType, Long> {

    List<DnsRecordType> findAllByOrderByTypeAsc();

    List<DnsRecordType> findByActiveTrueOrderByTypeAsc();

    Optional<DnsRecordType> findByTypeIgnoreCase(String type);

    boolean existsByTypeIgnoreCase(String type);
}

package com.dradmin.dns.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.dns.entity.DnsZonePackage;

@Repository
public interface DnsZonePackageRepository extends JpaRepository<DnsZonePackage, Long> {

    List<DnsZonePackage> findAllByOrderBySortOrderAscNameAsc();

    @EntityGraph(attributePaths = {"records", "records.type"})
    @Query("SELECT DISTINCT p FROM DnsZonePackage p ORDER BY p.sortOrder, p.name")
    List<DnsZonePackage> findAllWithRecords();

    List<DnsZonePackage> findByActiveTrueOrderBySortOrderAscNameAsc();

    @EntityGraph(attributePaths = {"records", "records.type"})
    @Query("SELECT p FROM DnsZonePackage p WHERE p.id = :id")
    Optional<DnsZonePackage> findWithRecordsById(@Param("id") Long id);

    Optional<DnsZonePackage> findFirstByDefaultPackageTrue();

    List<DnsZonePackage> findByDefaultPackageTrue();
}

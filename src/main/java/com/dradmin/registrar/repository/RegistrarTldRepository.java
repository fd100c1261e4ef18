package com.dradmin.registrar.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.registrar.entity.RegistrarTld;

@Repository
public interface RegistrarTldRepository extends JpaRepository<RegistrarTld, Long> {

    @Query("SELECT rt FROM RegistrarTld rt JOIN FETCH rt.registrar JOIN FETCH rt.tld ORDER BY rt.registrar.name, rt.tld.extension")
    List<RegistrarTld> findAllWithRegistrarAndTld();

    @Query("SELECT rt FROM RegistrarTld rt JOIN FETCH rt.registrar JOIN FETCH rt.tld WHERE rt.registrar.id = :registrarId "
            + "ORDER BY rt.tld.extension")
    List<RegistrarTld> findByRegistrarId(@Param("registrarId") Long registrarId);

    @Query("SELECT rt FROM RegistrarTld rt JOIN FETCH rt.registrar JOIN FETCH rt.tld WHERE rt.tld.id = :tldId "
            + "ORDER BY rt.registrar.name")
    List<RegistrarTld> findByTldId(@Param("tldId") Long tldId);

    @Query("SELECT rt FROM RegistrarTld rt JOIN FETCH rt.tld WHERE rt.registrar.id = :registrarId "
            + "AND rt.active = true AND rt.tld.active = true")
    List<RegistrarTld> findActiveForSync(@Param("registrarId") Long registrarId);

    Optional<RegistrarTld> findByRegistrarIdAndTldId(Long registrarId, Long tldId);

    boolean existsByRegistrarIdAndTldId(Long registrarId, Long tldId);
}

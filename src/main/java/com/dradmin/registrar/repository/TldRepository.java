package com.dradmin.registrar.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.registrar.entity.Tld;

@Repository
public interface TldRepository extends JpaRepository<Tld, Long> {

    List<Tld> findAllByOrderByExtensionAsc();

    List<Tld> findByActiveTrueOrderByExtensionAsc();

    Optional<Tld> findByExtension(String extension);

    boolean existsByExtension(String extension);
}

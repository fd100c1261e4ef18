package com.dradmin.registrar.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.registrar.entity.Registrar;

@Repository
public interface RegistrarRepository extends JpaRepository<Registrar, Long> {

    List<Registrar> findAllByOrderByNameAsc();

    List<Registrar> findByActiveTrueOrderByNameAsc();

    Optional<Registrar> findByCodeIgnoreCase(String code);

    boolean existsByCodeIgnoreCase(String code);
}

package com.dradmin.registrar.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.registrar.entity.RegistrarTldPriceDownloadSession;

@Repository
public interface RegistrarTldPriceDownloadSessionRepository extends JpaRepository<RegistrarTldPriceDownloadSession, Long> {

    boolean existsByRegistrarIdAndSuccessTrueAndStartedAtGreaterThanEqual(Long registrarId, LocalDateTime since);

    List<RegistrarTldPriceDownloadSession> findTop50ByRegistrarIdOrderByStartedAtDesc(Long registrarId);
}

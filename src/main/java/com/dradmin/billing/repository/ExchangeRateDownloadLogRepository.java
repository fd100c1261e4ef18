package com.dradmin.billing.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.ExchangeRateDownloadLog;

@Repository
public interface ExchangeRateDownloadLogRepository extends JpaRepository<ExchangeRateDownloadLog, Long> {

    List<ExchangeRateDownloadLog> findTop50ByOrderByStartedAtDesc();
}

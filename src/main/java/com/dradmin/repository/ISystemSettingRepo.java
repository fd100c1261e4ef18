package com.dradmin.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.entity.SystemSetting;

import jakarta.persistence.LockModeType;

@Repository
public interface ISystemSettingRepo extends JpaRepository<SystemSetting, Long> {

	Optional<SystemSetting> findByKey(String key);

	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@Query("SELECT s FROM SystemSetting s WHERE s.key = :key")
	Optional<SystemSetting> findByKeyForUpdate(@Param("key") String key);

	boolean existsByKey(String key);
}

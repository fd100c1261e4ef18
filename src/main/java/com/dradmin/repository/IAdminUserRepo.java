package com.dradmin.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.entity.AdminUser;

@Repository
public interface IAdminUserRepo extends JpaRepository<AdminUser, Long> {

	Optional<AdminUser> findByEmailIgnoreCase(String email);

	boolean existsByEmailIgnoreCase(String email);
}

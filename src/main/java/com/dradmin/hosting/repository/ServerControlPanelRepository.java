package com.dradmin.hosting.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.dradmin.hosting.entity.ServerControlPanel;

@Repository
public interface ServerControlPanelRepository extends JpaRepository<ServerControlPanel, Long> {

    List<ServerControlPanel> findAllByOrderByNameAsc();

    List<ServerControlPanel> findByActiveTrueOrderByNameAsc();
}

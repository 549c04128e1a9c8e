package com.quikdb.core.repository;

import com.quikdb.core.domain.EmergencyPauseState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for subsystem kill-switches.
 */
@Repository
public interface EmergencyPauseStateRepository extends JpaRepository<EmergencyPauseState, String> {

    List<EmergencyPauseState> findByActiveTrue();
}

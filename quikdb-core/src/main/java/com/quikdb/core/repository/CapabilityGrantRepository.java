package com.quikdb.core.repository;

import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.CapabilityGrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for account capability grants.
 */
@Repository
public interface CapabilityGrantRepository extends JpaRepository<CapabilityGrant, UUID> {

    boolean existsByAccountAndCapability(String account, Capability capability);

    Optional<CapabilityGrant> findByAccountAndCapability(String account, Capability capability);

    List<CapabilityGrant> findByAccount(String account);
}

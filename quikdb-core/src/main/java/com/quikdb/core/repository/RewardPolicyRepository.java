package com.quikdb.core.repository;

import com.quikdb.core.domain.RewardPolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the reward engine's economic parameters.
 */
@Repository
public interface RewardPolicyRepository extends JpaRepository<RewardPolicy, String> {
}

package com.quikdb.core.repository;

import com.quikdb.core.domain.SlashingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for applied slashes.
 */
@Repository
public interface SlashingRecordRepository extends JpaRepository<SlashingRecord, UUID> {

    List<SlashingRecord> findByOperatorOrderBySlashedAtDesc(String operator);

    long countByOperator(String operator);
}

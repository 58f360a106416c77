package com.allowance.infrastructure.persistence.repository;

import com.allowance.domain.model.LimitPeriod;
import com.allowance.infrastructure.persistence.entity.SpendingLimitTrackerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SpendingLimitTrackerRepository extends JpaRepository<SpendingLimitTrackerEntity, UUID> {

    Optional<SpendingLimitTrackerEntity> findByChildIdAndPeriodAndPeriodStart(
            UUID childId, LimitPeriod period, Instant periodStart);

    /**
     * Retention cleanup; the only way trackers are ever deleted.
     */
    @Modifying
    @Query("delete from SpendingLimitTrackerEntity t where t.periodEnd < :cutoff")
    int deleteByPeriodEndBefore(@Param("cutoff") Instant cutoff);
}

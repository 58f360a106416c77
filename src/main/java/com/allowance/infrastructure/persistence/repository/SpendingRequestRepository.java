package com.allowance.infrastructure.persistence.repository;

import com.allowance.domain.model.RequestStatus;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SpendingRequestRepository extends JpaRepository<SpendingRequestEntity, UUID> {

    List<SpendingRequestEntity> findByChildIdOrderByCreatedAtDesc(UUID childId);

    List<SpendingRequestEntity> findByChildIdAndStatusOrderByCreatedAtDesc(UUID childId, RequestStatus status);

    List<SpendingRequestEntity> findByFamilyIdAndStatusOrderByCreatedAtAsc(UUID familyId, RequestStatus status);

    /**
     * Overdue candidates for the expiration sweep, oldest deadline first.
     */
    List<SpendingRequestEntity> findByStatusAndExpiresAtBeforeOrderByExpiresAtAsc(
            RequestStatus status, Instant now, Pageable page);

    long countByChildIdAndStatus(UUID childId, RequestStatus status);

    @Query("select coalesce(sum(r.amount), 0) from SpendingRequestEntity r "
            + "where r.childId = :childId and r.status = :status")
    BigDecimal sumAmountByChildIdAndStatus(@Param("childId") UUID childId, @Param("status") RequestStatus status);
}

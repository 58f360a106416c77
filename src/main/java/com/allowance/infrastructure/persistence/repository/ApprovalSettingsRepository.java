package com.allowance.infrastructure.persistence.repository;

import com.allowance.infrastructure.persistence.entity.ApprovalSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApprovalSettingsRepository extends JpaRepository<ApprovalSettingsEntity, UUID> {

    Optional<ApprovalSettingsEntity> findByChildId(UUID childId);
}

package com.flagship.settlement.affiliate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConversionRepository extends JpaRepository<ConversionEntity, UUID> {

    Optional<ConversionEntity> findByClickId(UUID clickId);
}

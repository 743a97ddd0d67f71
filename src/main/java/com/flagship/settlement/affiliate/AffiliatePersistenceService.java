package com.flagship.settlement.affiliate;

import com.flagship.settlement.affiliate.event.CommissionRecordedEvent;
import com.flagship.settlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Affiliate writes, each in its own database transaction.
 *
 * The conversion insert commits on its own so a later failure updating the
 * click or the campaign counter cannot roll back a commission that was
 * already recorded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AffiliatePersistenceService {

    private static final String AGGREGATE_TYPE = "Conversion";

    private final AffiliateClickRepository clickRepository;
    private final AffiliateCampaignRepository campaignRepository;
    private final ConversionRepository conversionRepository;
    private final OutboxService outboxService;

    @Transactional(readOnly = true)
    public Optional<AffiliateClick> findClick(UUID clickId) {
        return clickRepository.findById(clickId).map(AffiliateClickEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<AffiliateCampaign> findCampaign(UUID campaignId) {
        return campaignRepository.findById(campaignId).map(AffiliateCampaignEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Conversion> findConversionByClick(UUID clickId) {
        return conversionRepository.findByClickId(clickId).map(ConversionEntity::toDomain);
    }

    /**
     * Inserts the conversion and its CommissionRecorded event.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when the
     *         click already has a conversion
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Conversion recordConversion(Conversion conversion) {
        Conversion saved = conversionRepository.saveAndFlush(ConversionEntity.fromDomain(conversion)).toDomain();
        outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
            CommissionRecordedEvent.EVENT_TYPE, CommissionRecordedEvent.from(saved));
        log.debug("Saved conversion {} for click {}", saved.getId(), saved.getClickId());
        return saved;
    }

    /**
     * @return false if the click was already marked converted
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markClickConverted(UUID clickId, UUID conversionId) {
        return clickRepository.markConverted(clickId, conversionId, Instant.now()) == 1;
    }

    /**
     * @return false if the campaign counter was already at its cap
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean incrementCampaignConversions(UUID campaignId) {
        return campaignRepository.incrementConversions(campaignId, Instant.now()) == 1;
    }
}

package com.talentforge.service;

import com.talentforge.model.CampaignSend;
import com.talentforge.model.CampaignSendStatus;
import com.talentforge.repository.CampaignRepository;
import com.talentforge.repository.CampaignSendRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-send engagement writes and the campaign counters that go with them.
 *
 * <p>Each method writes its timestamp only if it is still null and bumps the
 * counter only when that write actually happened, so a repeated event is a
 * no-op whether or not the ledger caught it. Must run inside the caller's
 * transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class CampaignMetricsUpdater {

    private final CampaignSendRepository sendRepository;
    private final CampaignRepository campaignRepository;
    private final Clock clock;

    public boolean recordDelivered(CampaignSend send, Instant at) {
        if (sendRepository.markDelivered(send.getId(), at) == 0) {
            return false;
        }
        advanceStatus(send, CampaignSendStatus.DELIVERED, at);
        campaignRepository.incrementSent(send.getCampaignId(), clock.instant());
        return true;
    }

    public boolean recordOpened(CampaignSend send, Instant at) {
        if (sendRepository.markOpened(send.getId(), at) == 0) {
            return false;
        }
        advanceStatus(send, CampaignSendStatus.OPENED, at);
        campaignRepository.incrementOpened(send.getCampaignId(), clock.instant());
        return true;
    }

    public boolean recordClicked(CampaignSend send, Instant at) {
        if (sendRepository.markClicked(send.getId(), at) == 0) {
            return false;
        }
        advanceStatus(send, CampaignSendStatus.CLICKED, at);
        campaignRepository.incrementClicked(send.getCampaignId(), clock.instant());
        return true;
    }

    public boolean recordBounced(CampaignSend send, Instant at, String errorMessage) {
        if (sendRepository.markBounced(send.getId(), at, errorMessage) == 0) {
            return false;
        }
        advanceStatus(send, CampaignSendStatus.BOUNCED, at);
        campaignRepository.incrementBounced(send.getCampaignId(), clock.instant());
        return true;
    }

    /**
     * Status only moves up the rank order; a late event leaves a later status in place.
     */
    private void advanceStatus(CampaignSend send, CampaignSendStatus target, Instant at) {
        Set<CampaignSendStatus> from = Arrays.stream(CampaignSendStatus.values())
                .filter(status -> status.canAdvanceTo(target))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(CampaignSendStatus.class)));
        if (sendRepository.advanceStatus(send.getId(), target, from, at) == 0) {
            log.debug("Send {} already past {}, status kept", send.getId(), target);
        }
    }
}

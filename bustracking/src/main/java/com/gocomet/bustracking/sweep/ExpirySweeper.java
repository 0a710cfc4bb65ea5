package com.gocomet.bustracking.sweep;

import com.gocomet.bustracking.common.config.MissedBusProperties;
import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.gocomet.bustracking.flag.model.FlagStatus;
import com.gocomet.bustracking.flag.model.WaitingFlag;
import com.gocomet.bustracking.flag.repository.WaitingFlagRepository;
import com.gocomet.bustracking.flag.service.WaitingFlagService;
import com.gocomet.bustracking.missedbus.model.MissedBusRequest;
import com.gocomet.bustracking.missedbus.model.MissedBusStatus;
import com.gocomet.bustracking.missedbus.model.NoCandidatePolicy;
import com.gocomet.bustracking.missedbus.repository.MissedBusRequestRepository;
import com.gocomet.bustracking.missedbus.service.MissedBusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Server-side authority over deadlines. Each tick expires overdue waiting flags and
 * missed-bus requests, hands back seats held by approved requests whose pickup window
 * has closed, then retries matching for requests still pending.
 *
 * Work is taken in batches; whatever is left over is picked up on the next tick.
 * Match retries go least recently tried first, so every pending request gets a turn.
 * A failure on one entity is logged and does not stop the rest of the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpirySweeper {

    private final WaitingFlagRepository flagRepository;
    private final WaitingFlagService waitingFlagService;
    private final MissedBusRequestRepository requestRepository;
    private final MissedBusService missedBusService;
    private final RealtimeProperties realtimeProperties;
    private final MissedBusProperties missedBusProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.realtime.sweep.interval-ms:30000}")
    public void sweep() {
        int flags = expireFlags();
        int requests = expireRequests();
        int seats = closePickupWindows();
        int retried = retryPendingMatches();
        if (flags > 0 || requests > 0 || seats > 0 || retried > 0) {
            log.info("Sweep: expired {} flags and {} missed-bus requests, released {} seats, retried {} matches",
                    flags, requests, seats, retried);
        }
    }

    int expireFlags() {
        Instant now = clock.instant();
        List<WaitingFlag> due = flagRepository.findByStatusInAndExpiresAtLessThanEqual(
                FlagStatus.ACTIVE, now, PageRequest.of(0, batchSize()));
        int expired = 0;
        for (WaitingFlag flag : due) {
            try {
                if (waitingFlagService.expire(flag.getId())) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to expire waiting flag {}: {}", flag.getId(), e.getMessage());
            }
        }
        return expired;
    }

    int expireRequests() {
        Instant now = clock.instant();
        List<MissedBusRequest> due = requestRepository.findByStatusAndExpiresAtLessThanEqual(
                MissedBusStatus.PENDING, now, PageRequest.of(0, batchSize()));
        int expired = 0;
        for (MissedBusRequest request : due) {
            try {
                if (missedBusService.expire(request.getId())) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to expire missed-bus request {}: {}", request.getId(), e.getMessage());
            }
        }
        return expired;
    }

    int closePickupWindows() {
        Instant now = clock.instant();
        List<MissedBusRequest> due = requestRepository.findByStatusAndSeatHeldTrueAndExpiresAtLessThanEqual(
                MissedBusStatus.APPROVED, now, PageRequest.of(0, batchSize()));
        int released = 0;
        for (MissedBusRequest request : due) {
            try {
                if (missedBusService.closePickupWindow(request.getId())) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to release seat for missed-bus request {}: {}", request.getId(), e.getMessage());
            }
        }
        return released;
    }

    int retryPendingMatches() {
        if (missedBusProperties.getNoCandidatePolicy() != NoCandidatePolicy.KEEP_PENDING) {
            return 0;
        }
        Instant now = clock.instant();
        List<MissedBusRequest> pending = requestRepository.findByStatusAndExpiresAtAfterOrderByLastMatchAttemptAtAsc(
                MissedBusStatus.PENDING, now, PageRequest.of(0, batchSize()));
        if (pending.isEmpty()) {
            return 0;
        }
        requestRepository.markMatchAttempted(pending.stream().map(MissedBusRequest::getId).toList(), now);

        int retried = 0;
        for (MissedBusRequest request : pending) {
            try {
                missedBusService.retryMatch(request.getId());
                retried++;
            } catch (RuntimeException e) {
                log.warn("Match retry failed for request {}: {}", request.getId(), e.getMessage());
            }
        }
        return retried;
    }

    private int batchSize() {
        return realtimeProperties.getSweep().getBatchSize();
    }
}

package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.ControlPlaneSnapshot;
import com.signalloop.model.ControlPlaneState;
import com.signalloop.repository.ControlPlaneStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the versioned control-plane rows. Exactly one row is active (null
 * {@code expires_at}); a transition expires it and inserts the successor in
 * one transaction, under a database advisory lock.
 */
@Service
public class ControlPlaneService {

    static final String BOOTSTRAP_ACTOR = "bootstrap";
    private static final int MAX_HISTORY = 100;

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneService.class);

    private final ControlPlaneStateRepository controlPlaneStateRepository;
    private final TransactionTemplate transactionTemplate;
    private final SignalLoopProperties properties;
    private final Clock clock;
    private final ReentrantLock transitionLock = new ReentrantLock();

    private volatile ControlPlaneSnapshot cachedActive;

    public ControlPlaneService(
            ControlPlaneStateRepository controlPlaneStateRepository,
            TransactionTemplate transactionTemplate,
            SignalLoopProperties properties,
            Clock clock) {
        this.controlPlaneStateRepository = controlPlaneStateRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            ControlPlaneSnapshot active = getActiveState();
            log.info("Active control-plane state {}: threshold={}, explorationRate={}, templates={}",
                    active.id(), active.acceptanceThreshold(), active.explorationRate(),
                    active.templateWeights().size());
        } catch (DataAccessException ex) {
            log.warn("Control-plane state unavailable at startup: {}", ex.getMessage());
        }
    }

    /**
     * Returns the active state, inserting the default row when none exists.
     */
    public ControlPlaneSnapshot getActiveState() {
        ControlPlaneSnapshot active = controlPlaneStateRepository.findFirstByExpiresAtIsNullOrderByEffectiveAtDesc()
                .map(ControlPlaneSnapshot::from)
                .orElseGet(this::bootstrap);
        cachedActive = active;
        return active;
    }

    /**
     * Last loaded active state without touching the database.
     */
    public Optional<ControlPlaneSnapshot> cachedActiveState() {
        return Optional.ofNullable(cachedActive);
    }

    public List<ControlPlaneSnapshot> history(int limit) {
        int pageSize = Math.max(1, Math.min(MAX_HISTORY, limit));
        return controlPlaneStateRepository.findAllByOrderByEffectiveAtDesc(PageRequest.of(0, pageSize)).stream()
                .map(ControlPlaneSnapshot::from)
                .toList();
    }

    /**
     * Expires the active row and inserts {@code next} as the new active row.
     *
     * @param next New parameters; id and timestamps are ignored
     * @param updatedBy Provenance actor
     * @param reason Provenance reason
     * @return The persisted new active state
     * @throws PolicyUpdateException when another transition holds the lock or the write fails
     */
    public ControlPlaneSnapshot transition(ControlPlaneSnapshot next, String updatedBy, String reason) {
        if (!transitionLock.tryLock()) {
            throw new PolicyUpdateException("A control-plane transition is already in progress");
        }
        try {
            ControlPlaneSnapshot persisted = transactionTemplate.execute(status -> {
                if (!controlPlaneStateRepository.tryAdvisoryTransactionLock(
                        properties.getPolicy().getAdvisoryLockKey())) {
                    throw new PolicyUpdateException("Another process holds the control-plane lock");
                }
                OffsetDateTime now = OffsetDateTime.now(clock);
                int expired = controlPlaneStateRepository.expireActive(now);
                ControlPlaneState state = next.toNewState(now);
                state.setUpdatedBy(updatedBy);
                state.setUpdateReason(truncate(reason));
                ControlPlaneState saved = controlPlaneStateRepository.saveAndFlush(state);
                log.info("Control-plane transition by {}: expired {} row(s), activated {}",
                        updatedBy, expired, saved.getId());
                return ControlPlaneSnapshot.from(saved);
            });
            cachedActive = persisted;
            return persisted;
        } catch (DataAccessException | TransactionException ex) {
            throw new PolicyUpdateException("Control-plane transition failed: " + ex.getMessage(), ex);
        } finally {
            transitionLock.unlock();
        }
    }

    private ControlPlaneSnapshot bootstrap() {
        SignalLoopProperties.Policy policy = properties.getPolicy();
        try {
            ControlPlaneSnapshot created = transactionTemplate.execute(status -> {
                Optional<ControlPlaneState> raced =
                        controlPlaneStateRepository.findFirstByExpiresAtIsNullOrderByEffectiveAtDesc();
                if (raced.isPresent()) {
                    return ControlPlaneSnapshot.from(raced.get());
                }
                ControlPlaneState state = new ControlPlaneState();
                state.setEffectiveAt(OffsetDateTime.now(clock));
                state.setAcceptanceThreshold(policy.getDefaultAcceptanceThreshold());
                state.setExplorationRate(policy.getDefaultExplorationRate());
                state.setTemplateWeights(new LinkedHashMap<>());
                state.setPromptVersionWeights(new LinkedHashMap<>());
                state.setUpdatedBy(BOOTSTRAP_ACTOR);
                state.setUpdateReason("initial default policy");
                return ControlPlaneSnapshot.from(controlPlaneStateRepository.saveAndFlush(state));
            });
            log.info("Bootstrapped default control-plane state {}", created.id());
            return created;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Concurrent control-plane bootstrap detected, reloading active state");
            return controlPlaneStateRepository.findFirstByExpiresAtIsNullOrderByEffectiveAtDesc()
                    .map(ControlPlaneSnapshot::from)
                    .orElseThrow(() -> ex);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 512) {
            return reason;
        }
        return reason.substring(0, 509) + "...";
    }
}

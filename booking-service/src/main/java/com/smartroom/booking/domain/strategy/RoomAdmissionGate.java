package com.smartroom.booking.domain.strategy;

import com.smartroom.booking.config.BookingEngineProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point to the per-room admission boundary.
 *
 * Spring injects every {@link RoomLockStrategy} keyed by bean name; the active one is picked by
 * {@code booking.admission.lock-strategy} (local | distributed), falling back to local.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomAdmissionGate {

    static final String DEFAULT_STRATEGY = "local";

    private final Map<String, RoomLockStrategy> lockStrategies;
    private final BookingEngineProperties properties;

    @PostConstruct
    public void init() {
        log.info("Initialized RoomAdmissionGate with strategy: {}", getLockStrategy().getStrategyType());
    }

    /**
     * Waits up to the configured lock wait for the room's admission lock.
     *
     * @return the held lock, or empty when the room stayed busy for the whole wait
     */
    public Optional<RoomLock> tryEnter(Long roomId) throws InterruptedException {
        return getLockStrategy().tryAcquire(roomId, properties.getAdmission().getLockWait());
    }

    RoomLockStrategy getLockStrategy() {
        String configured = properties.getAdmission().getLockStrategy();
        String strategyKey = configured == null ? DEFAULT_STRATEGY : configured.toLowerCase();

        RoomLockStrategy strategy = lockStrategies.get(strategyKey);
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    configured, lockStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " lock strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }
}

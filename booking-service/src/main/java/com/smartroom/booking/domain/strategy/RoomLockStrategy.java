package com.smartroom.booking.domain.strategy;

import java.time.Duration;
import java.util.Optional;

/**
 * Strategy interface for per-room mutual exclusion around booking admission.
 *
 * Implementations (bean names):
 * - local: fair in-process lock per room, single instance deployments
 * - distributed: Redisson fair lock per room, shared by all instances
 *
 * Waiters on the same room are served in arrival order. Different rooms never contend.
 */
public interface RoomLockStrategy {

    /**
     * Waits up to {@code wait} for the room's lock.
     *
     * @return the held lock, or empty if the wait elapsed
     * @throws InterruptedException if the caller was interrupted while waiting; nothing is held then
     */
    Optional<RoomLock> tryAcquire(Long roomId, Duration wait) throws InterruptedException;

    /**
     * @return strategy type name, used in logs
     */
    String getStrategyType();
}

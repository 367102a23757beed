package com.smartroom.booking.domain.strategy;

import com.smartroom.booking.config.BookingEngineProperties;
import com.smartroom.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Admission lock shared across service instances, backed by a Redisson fair lock per room.
 *
 * The lease bounds how long a crashed holder can block a room. It must stay well above the
 * longest admission (conflict check plus two persistence attempts).
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedRoomLockStrategy implements RoomLockStrategy {

    private final RedissonClient redissonClient;
    private final BookingEngineProperties properties;

    @Override
    public Optional<RoomLock> tryAcquire(Long roomId, Duration wait) throws InterruptedException {
        String lockKey = buildLockKey(roomId);
        RLock lock = redissonClient.getFairLock(lockKey);
        long leaseMillis = properties.getAdmission().getLockLease().toMillis();

        boolean acquired = lock.tryLock(wait.toMillis(), leaseMillis, TimeUnit.MILLISECONDS);
        if (!acquired) {
            log.debug("Timed out waiting for distributed lock: {}", lockKey);
            return Optional.empty();
        }
        log.debug("Acquired distributed lock: {}", lockKey);
        return Optional.of(new HeldLock(roomId, lockKey, lock));
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    static String buildLockKey(Long roomId) {
        return Constants.LOCK_PREFIX + roomId;
    }

    private record HeldLock(Long roomId, String lockKey, RLock lock) implements RoomLock {
        @Override
        public void close() {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            } else {
                log.warn("Distributed lock {} no longer held at release, lease may have expired", lockKey);
            }
        }
    }
}

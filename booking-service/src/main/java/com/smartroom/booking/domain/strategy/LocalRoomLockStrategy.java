package com.smartroom.booking.domain.strategy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process admission lock: one fair {@link ReentrantLock} per room, created on first use.
 *
 * Locks are never removed from the map; the number of rooms is small and bounded.
 */
@Slf4j
@Component("local")
public class LocalRoomLockStrategy implements RoomLockStrategy {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<RoomLock> tryAcquire(Long roomId, Duration wait) throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(roomId, id -> new ReentrantLock(true));
        if (!lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS)) {
            log.debug("Timed out waiting for local lock: roomId={}, wait={}", roomId, wait);
            return Optional.empty();
        }
        log.debug("Acquired local lock: roomId={}", roomId);
        return Optional.of(new HeldLock(roomId, lock));
    }

    @Override
    public String getStrategyType() {
        return "LOCAL_LOCK";
    }

    int trackedRooms() {
        return locks.size();
    }

    private static final class HeldLock implements RoomLock {
        private final Long roomId;
        private final ReentrantLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        private HeldLock(Long roomId, ReentrantLock lock) {
            this.roomId = roomId;
            this.lock = lock;
        }

        @Override
        public Long roomId() {
            return roomId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
                log.debug("Released local lock: roomId={}", roomId);
            }
        }
    }
}

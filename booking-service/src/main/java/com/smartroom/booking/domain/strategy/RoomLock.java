package com.smartroom.booking.domain.strategy;

/**
 * A held per-room admission lock. Closing releases it; closing twice is a no-op.
 */
public interface RoomLock extends AutoCloseable {

    Long roomId();

    @Override
    void close();
}

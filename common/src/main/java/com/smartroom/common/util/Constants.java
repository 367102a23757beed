package com.smartroom.common.util;

/**
 * Constants shared by the booking modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    /** Key prefix of the distributed per-room admission lock. */
    public static final String LOCK_PREFIX = "lock:room:";

    /** Actor id recorded when the engine itself cancels a booking (override supersession). */
    public static final long SYSTEM_ACTOR_ID = 0L;

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
}

package com.smartroom.booking.domain.model;

/**
 * Already-authenticated caller of an engine operation.
 */
public record Actor(Long userId, ActorRole role) {

    public Actor {
        if (userId == null) {
            throw new IllegalArgumentException("Actor user id is required");
        }
        role = role == null ? ActorRole.USER : role;
    }

    public static Actor user(Long userId) {
        return new Actor(userId, ActorRole.USER);
    }

    public boolean owns(Booking booking) {
        return userId.equals(booking.getUserId());
    }

    public boolean canModify(Booking booking) {
        return owns(booking) || role.canManageOthers();
    }

    public boolean canView(Booking booking) {
        return owns(booking) || role.canViewAll();
    }
}

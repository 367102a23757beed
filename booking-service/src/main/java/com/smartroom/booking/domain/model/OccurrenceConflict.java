package com.smartroom.booking.domain.model;

/**
 * A candidate occurrence and the existing occurrence it overlaps.
 */
public record OccurrenceConflict(Occurrence candidate, Occurrence existing) {
}

package com.smartroom.booking.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a create or reschedule request. Conflict and busy are ordinary outcomes, not errors.
 *
 * @param booking    the confirmed booking; on a conflict, the rejected new booking (create) or the
 *                   unchanged one (reschedule); null when busy
 * @param conflicts  every overlapping pair found, empty unless {@link Status#CONFLICT}
 * @param superseded ids of bookings cancelled by an override
 */
public record AdmissionResult(
        Status status,
        Booking booking,
        List<OccurrenceConflict> conflicts,
        List<Long> superseded
) {
    public enum Status {
        CONFIRMED,
        CONFLICT,
        BUSY
    }

    public AdmissionResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        superseded = superseded == null ? List.of() : List.copyOf(superseded);
    }

    public static AdmissionResult confirmed(Booking booking, List<Long> superseded) {
        return new AdmissionResult(Status.CONFIRMED, booking, List.of(), superseded);
    }

    public static AdmissionResult conflict(Booking booking, List<OccurrenceConflict> conflicts) {
        return new AdmissionResult(Status.CONFLICT, booking, conflicts, List.of());
    }

    public static AdmissionResult busy() {
        return new AdmissionResult(Status.BUSY, null, List.of(), List.of());
    }

    public boolean admitted() {
        return status == Status.CONFIRMED;
    }

    public Set<Long> conflictingBookingIds() {
        Set<Long> ids = new LinkedHashSet<>();
        conflicts.forEach(conflict -> ids.add(conflict.existing().bookingId()));
        return ids;
    }
}

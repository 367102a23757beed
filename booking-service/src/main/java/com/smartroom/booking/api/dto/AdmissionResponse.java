package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.AdmissionResult;

import java.util.List;
import java.util.stream.Collectors;

public record AdmissionResponse(
        AdmissionResult.Status status,
        BookingResponse booking,
        List<ConflictResponse> conflicts,
        List<Long> supersededBookingIds
) {
    public static AdmissionResponse from(AdmissionResult result) {
        return new AdmissionResponse(
                result.status(),
                result.booking() == null ? null : BookingResponse.from(result.booking()),
                result.conflicts().stream().map(ConflictResponse::from).collect(Collectors.toList()),
                result.superseded()
        );
    }
}

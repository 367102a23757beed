package com.smartroom.booking.client.dto;

public record RoomSummary(
        Long id,
        String name,
        Integer capacity,
        String status
) {
}

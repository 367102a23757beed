package com.smartroom.booking.events;

public enum BookingEventType {
    CONFIRMED("booking-confirmed"),
    REJECTED("booking-rejected"),
    CANCELLED("booking-cancelled"),
    SUPERSEDED("booking-superseded");

    private final String topic;

    BookingEventType(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}

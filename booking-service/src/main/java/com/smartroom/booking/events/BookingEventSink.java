package com.smartroom.booking.events;

/**
 * Outbound port for booking lifecycle events. Publishing never fails the caller.
 */
public interface BookingEventSink {

    void publish(BookingLifecycleEvent event);
}

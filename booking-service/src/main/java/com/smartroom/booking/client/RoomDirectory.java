package com.smartroom.booking.client;

import com.smartroom.booking.client.dto.RoomSummary;

/**
 * Room inventory as seen by the booking engine.
 */
public interface RoomDirectory {

    /**
     * @return the room as the directory currently describes it
     * @throws com.smartroom.common.exception.ResourceNotFoundException if there is no such room
     * @throws com.smartroom.common.exception.ServiceUnavailableException if the directory cannot be reached
     */
    RoomSummary requireRoom(Long roomId);
}

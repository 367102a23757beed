package com.smartroom.booking.client;

import com.smartroom.booking.client.dto.RoomSummary;
import com.smartroom.common.dto.BaseResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * Feign client for the rooms service, the source of truth for which rooms exist.
 */
@FeignClient(name = "room-service", url = "${booking.room-directory.url}", path = "/api/rooms")
public interface RoomServiceClient {

    @GetMapping("/{roomId}")
    BaseResponse<RoomSummary> getRoom(@PathVariable("roomId") Long roomId);
}

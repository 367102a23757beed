package com.smartroom.booking.client;

import com.smartroom.booking.client.dto.RoomSummary;
import com.smartroom.common.dto.BaseResponse;
import com.smartroom.common.exception.ResourceNotFoundException;
import com.smartroom.common.exception.ServiceUnavailableException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link RoomDirectory} backed by the rooms service.
 *
 * A missing room is an answer, not a failure: it is ignored by the circuit breaker and passed
 * through its fallback unchanged. Anything else that fails the call ends up as 503.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomDirectoryClientAdapter implements RoomDirectory {

    private final RoomServiceClient roomServiceClient;

    @Override
    @CircuitBreaker(name = "room-directory", fallbackMethod = "roomDirectoryUnavailable")
    public RoomSummary requireRoom(Long roomId) {
        BaseResponse<RoomSummary> response;
        try {
            response = roomServiceClient.getRoom(roomId);
        } catch (FeignException.NotFound e) {
            log.debug("Room directory lookup: roomId={} not found", roomId);
            throw new ResourceNotFoundException("Room", roomId);
        }
        if (response == null || !response.isSuccess() || response.getData() == null) {
            log.debug("Room directory lookup: roomId={} returned no room", roomId);
            throw new ResourceNotFoundException("Room", roomId);
        }
        log.debug("Room directory lookup: roomId={}, capacity={}", roomId, response.getData().capacity());
        return response.getData();
    }

    private RoomSummary roomDirectoryUnavailable(Long roomId, ResourceNotFoundException ex) {
        throw ex;
    }

    private RoomSummary roomDirectoryUnavailable(Long roomId, Throwable ex) {
        log.error("Room directory unavailable while checking room {}", roomId, ex);
        throw new ServiceUnavailableException("Room directory temporarily unavailable. Retry later.", ex);
    }
}

package com.smartroom.booking.client;

import com.smartroom.booking.client.dto.RoomSummary;
import com.smartroom.common.dto.BaseResponse;
import com.smartroom.common.exception.ResourceNotFoundException;
import feign.FeignException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
class RoomDirectoryClientAdapterTest {

    @Mock
    private RoomServiceClient roomServiceClient;

    @InjectMocks
    private RoomDirectoryClientAdapter adapter;

    @Test
    @DisplayName("room is returned with its capacity when the rooms service knows it")
    void requireRoom_found() {
        given(roomServiceClient.getRoom(101L))
                .willReturn(BaseResponse.success(new RoomSummary(101L, "Orion", 8, "ACTIVE")));

        RoomSummary room = adapter.requireRoom(101L);

        assertThat(room.capacity()).isEqualTo(8);
    }

    @Test
    @DisplayName("404 and empty envelopes mean the room does not exist")
    void requireRoom_notFound() {
        willThrow(FeignException.NotFound.class).given(roomServiceClient).getRoom(404L);
        given(roomServiceClient.getRoom(405L)).willReturn(BaseResponse.error("gone", "RESOURCE_NOT_FOUND"));

        assertThatThrownBy(() -> adapter.requireRoom(404L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Room with identifier 404");
        assertThatThrownBy(() -> adapter.requireRoom(405L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}

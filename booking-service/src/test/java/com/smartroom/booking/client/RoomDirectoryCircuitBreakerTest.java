package com.smartroom.booking.client;

import com.smartroom.booking.client.dto.RoomSummary;
import com.smartroom.common.dto.BaseResponse;
import com.smartroom.common.exception.ResourceNotFoundException;
import com.smartroom.common.exception.ServiceUnavailableException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.springboot3.circuitbreaker.autoconfigure.CircuitBreakerAutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Runs {@link RoomDirectoryClientAdapter} behind the real Resilience4j aspect, the way the engine
 * calls it through the {@link RoomDirectory} interface.
 */
@SpringBootTest(classes = RoomDirectoryClientAdapter.class, properties = {
        "resilience4j.circuitbreaker.instances.room-directory.sliding-window-size=4",
        "resilience4j.circuitbreaker.instances.room-directory.minimum-number-of-calls=4",
        "resilience4j.circuitbreaker.instances.room-directory.failure-rate-threshold=50",
        "resilience4j.circuitbreaker.instances.room-directory.wait-duration-in-open-state=60s",
        "resilience4j.circuitbreaker.instances.room-directory.ignore-exceptions[0]="
                + "com.smartroom.common.exception.ResourceNotFoundException"
})
@ImportAutoConfiguration({AopAutoConfiguration.class, CircuitBreakerAutoConfiguration.class})
class RoomDirectoryCircuitBreakerTest {

    @Autowired
    private RoomDirectory roomDirectory;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @MockBean
    private RoomServiceClient roomServiceClient;

    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = circuitBreakerRegistry.circuitBreaker("room-directory");
        breaker.reset();
    }

    @Test
    @DisplayName("an unreachable directory surfaces as ServiceUnavailable")
    void requireRoom_directoryDown() {
        // given
        willThrow(new IllegalStateException("connect refused")).given(roomServiceClient).getRoom(7L);

        // when / then
        assertThatThrownBy(() -> roomDirectory.requireRoom(7L))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("Room directory temporarily unavailable");
        assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("repeated failures open the breaker and later calls never reach the directory")
    void requireRoom_breakerOpens() {
        // given
        willThrow(new IllegalStateException("connect refused")).given(roomServiceClient).getRoom(7L);
        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> roomDirectory.requireRoom(7L)).isInstanceOf(ServiceUnavailableException.class);
        }

        // when / then
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> roomDirectory.requireRoom(7L)).isInstanceOf(ServiceUnavailableException.class);
        verify(roomServiceClient, times(4)).getRoom(7L);
    }

    @Test
    @DisplayName("unknown rooms pass through as not found and never count against the breaker")
    void requireRoom_notFoundIsNotAFailure() {
        // given
        willThrow(FeignException.NotFound.class).given(roomServiceClient).getRoom(404L);

        // when / then
        for (int i = 0; i < 6; i++) {
            assertThatThrownBy(() -> roomDirectory.requireRoom(404L)).isInstanceOf(ResourceNotFoundException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isZero();
    }

    @Test
    @DisplayName("a known room comes back through the proxy unchanged")
    void requireRoom_found() {
        given(roomServiceClient.getRoom(101L))
                .willReturn(BaseResponse.success(new RoomSummary(101L, "Orion", 8, "ACTIVE")));

        assertThat(roomDirectory.requireRoom(101L).name()).isEqualTo("Orion");
    }
}

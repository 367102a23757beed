package com.smartroom.booking.domain.strategy;

import com.smartroom.booking.config.BookingEngineProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class RoomAdmissionGateTest {

    @Mock
    private RoomLockStrategy local;

    @Mock
    private RoomLockStrategy distributed;

    @Mock
    private RoomLock roomLock;

    private static BookingEngineProperties properties(String strategy) {
        BookingEngineProperties properties = new BookingEngineProperties();
        properties.getAdmission().setLockStrategy(strategy);
        properties.getAdmission().setLockWait(Duration.ofMillis(750));
        return properties;
    }

    @Test
    @DisplayName("configured strategy is selected by bean name, case-insensitively")
    void selectsConfiguredStrategy() throws Exception {
        // given
        RoomAdmissionGate gate = new RoomAdmissionGate(
                Map.of("local", local, "distributed", distributed), properties("Distributed"));
        given(distributed.tryAcquire(9L, Duration.ofMillis(750))).willReturn(Optional.of(roomLock));

        // when
        Optional<RoomLock> entered = gate.tryEnter(9L);

        // then
        assertThat(gate.getLockStrategy()).isSameAs(distributed);
        assertThat(entered).containsSame(roomLock);
    }

    @Test
    @DisplayName("unknown or missing strategy falls back to local")
    void fallsBackToLocal() {
        assertThat(new RoomAdmissionGate(Map.of("local", local), properties("zookeeper")).getLockStrategy())
                .isSameAs(local);
        assertThat(new RoomAdmissionGate(Map.of("local", local), properties(null)).getLockStrategy())
                .isSameAs(local);
    }

    @Test
    @DisplayName("no local strategy to fall back to is a configuration error")
    void failsWithoutLocal() {
        RoomAdmissionGate gate = new RoomAdmissionGate(Map.of("distributed", distributed), properties("local"));

        assertThatThrownBy(gate::getLockStrategy)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("local lock strategy not found");
    }
}

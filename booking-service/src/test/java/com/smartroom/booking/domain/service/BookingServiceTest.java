package com.smartroom.booking.domain.service;

import com.smartroom.booking.config.BookingEngineProperties;
import com.smartroom.booking.domain.model.Actor;
import com.smartroom.booking.domain.model.ActorRole;
import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.repository.BookingSearchCriteria;
import com.smartroom.booking.domain.repository.BookingStore;
import com.smartroom.booking.exception.BookingAccessDeniedException;
import com.smartroom.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    @Mock
    private BookingStore bookingStore;

    private BookingService bookingService;

    @BeforeEach
    void setUp() {
        bookingService = new BookingService(bookingStore, new BookingEngineProperties());
    }

    private static Booking ownedBy(Long userId) {
        return Booking.builder().id(5L).roomId(101L).userId(userId).status(Booking.BookingStatus.CONFIRMED).build();
    }

    @Test
    @DisplayName("owner and auditor can read a booking, other users cannot")
    void getBooking_access() {
        // given
        given(bookingStore.findById(5L)).willReturn(Optional.of(ownedBy(1L)));

        // when / then
        assertThat(bookingService.getBooking(5L, Actor.user(1L)).getId()).isEqualTo(5L);
        assertThat(bookingService.getBooking(5L, new Actor(9L, ActorRole.AUDITOR)).getId()).isEqualTo(5L);
        assertThatThrownBy(() -> bookingService.getBooking(5L, Actor.user(2L)))
                .isInstanceOf(BookingAccessDeniedException.class);
    }

    @Test
    @DisplayName("getBooking of an unknown id is not found")
    void getBooking_notFound() {
        given(bookingStore.findById(6L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.getBooking(6L, Actor.user(1L)))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("errorCode")
                .isEqualTo("RESOURCE_NOT_FOUND");
    }

    @Test
    @DisplayName("users list their own bookings; listing someone else's needs a view-all role")
    void getBookingsForUser_access() {
        given(bookingStore.findByUserId(1L)).willReturn(List.of(ownedBy(1L)));

        assertThat(bookingService.getBookingsForUser(1L, Actor.user(1L))).hasSize(1);
        assertThat(bookingService.getBookingsForUser(1L, new Actor(3L, ActorRole.ADMIN))).hasSize(1);
        assertThatThrownBy(() -> bookingService.getBookingsForUser(2L, Actor.user(1L)))
                .isInstanceOf(BookingAccessDeniedException.class);
        verify(bookingStore, never()).findByUserId(2L);
    }

    @Test
    @DisplayName("a plain user's listing is narrowed to their own bookings whatever the filters say")
    void listBookings_userScopedToOwnBookings() {
        // given
        BookingSearchCriteria criteria = new BookingSearchCriteria(
                null, 101L, Booking.BookingStatus.CONFIRMED, Instant.parse("2025-01-06T00:00:00Z"), null);
        given(bookingStore.search(any(BookingSearchCriteria.class), any(Pageable.class)))
                .willReturn(new PageImpl<>(List.of(ownedBy(1L))));

        // when
        Page<Booking> page = bookingService.listBookings(criteria, Actor.user(1L), 2, 10);

        // then
        ArgumentCaptor<BookingSearchCriteria> criteriaCaptor = ArgumentCaptor.forClass(BookingSearchCriteria.class);
        ArgumentCaptor<Pageable> pageCaptor = ArgumentCaptor.forClass(Pageable.class);
        verify(bookingStore).search(criteriaCaptor.capture(), pageCaptor.capture());
        assertThat(criteriaCaptor.getValue()).isEqualTo(criteria.forUser(1L));
        assertThat(pageCaptor.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageCaptor.getValue().getPageSize()).isEqualTo(10);
        assertThat(pageCaptor.getValue().getSort().getOrderFor("startTime").getDirection())
                .isEqualTo(Sort.Direction.DESC);
        assertThat(page.getContent()).hasSize(1);
    }

    @Test
    @DisplayName("auditors list everyone's bookings; page size is capped and page numbers start at 1")
    void listBookings_viewAllRoleAndPaging() {
        // given
        BookingSearchCriteria criteria = new BookingSearchCriteria(null, null, null, null, null);
        given(bookingStore.search(any(BookingSearchCriteria.class), any(Pageable.class)))
                .willReturn(Page.empty());

        // when
        bookingService.listBookings(criteria, new Actor(9L, ActorRole.AUDITOR), 0, 500);

        // then
        ArgumentCaptor<BookingSearchCriteria> criteriaCaptor = ArgumentCaptor.forClass(BookingSearchCriteria.class);
        ArgumentCaptor<Pageable> pageCaptor = ArgumentCaptor.forClass(Pageable.class);
        verify(bookingStore).search(criteriaCaptor.capture(), pageCaptor.capture());
        assertThat(criteriaCaptor.getValue().userId()).isNull();
        assertThat(pageCaptor.getValue().getPageNumber()).isZero();
        assertThat(pageCaptor.getValue().getPageSize()).isEqualTo(100);
    }
}

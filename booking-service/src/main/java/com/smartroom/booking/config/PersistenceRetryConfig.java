package com.smartroom.booking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.TransactionException;

/**
 * Retry policy for booking writes made while a room's admission lock is held:
 * one retry, then the failure is surfaced.
 *
 * Version conflicts reach the retry as {@code StaleBookingException}, which is never retried.
 */
@Configuration
public class PersistenceRetryConfig {

    static final int MAX_ATTEMPTS = 2;

    @Bean
    public RetryTemplate bookingWriteRetryTemplate(BookingEngineProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(MAX_ATTEMPTS)
                .fixedBackoff(properties.getAdmission().getPersistenceBackoff().toMillis())
                .retryOn(DataAccessException.class)
                .retryOn(TransactionException.class)
                .build();
    }
}

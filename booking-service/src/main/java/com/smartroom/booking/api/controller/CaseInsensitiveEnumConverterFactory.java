package com.smartroom.booking.api.controller;

import org.springframework.core.convert.converter.Converter;
import org.springframework.core.convert.converter.ConverterFactory;

import java.util.Locale;

/**
 * Binds enum headers and query parameters regardless of case, so a gateway forwarding
 * {@code facility_manager} or {@code confirmed} reaches the same constant as the upper-case name.
 * Unknown names still fail the binding.
 */
public class CaseInsensitiveEnumConverterFactory implements ConverterFactory<String, Enum> {

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T extends Enum> Converter<String, T> getConverter(Class<T> targetType) {
        return source -> {
            String name = source.trim();
            if (name.isEmpty()) {
                return null;
            }
            return (T) Enum.valueOf((Class) targetType, name.toUpperCase(Locale.ROOT));
        };
    }
}

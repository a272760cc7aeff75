package com.reservation.api.entity;

import com.reservation.api.exception.BookingException;

import java.util.Arrays;

/**
 * Role declared by the caller's account.
 */
public enum AccountRole {
    USER("user"),
    COMPANY("company");

    private final String value;

    AccountRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AccountRole fromValue(String raw) {
        return Arrays.stream(values())
                .filter(r -> r.value.equalsIgnoreCase(raw == null ? "" : raw.trim()))
                .findFirst()
                .orElseThrow(() -> new BookingException(BookingException.Reason.ROLE_NOT_PERMITTED,
                        "Unknown account role: " + raw));
    }
}

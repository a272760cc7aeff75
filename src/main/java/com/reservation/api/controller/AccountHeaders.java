package com.reservation.api.controller;

/**
 * Request headers carrying the caller's account, set by the authentication gateway.
 */
final class AccountHeaders {

    static final String ACCOUNT_ID = "X-Account-Id";
    static final String ACCOUNT_ROLE = "X-Account-Role";

    private AccountHeaders() {
    }
}

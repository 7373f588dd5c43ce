package com.flagship.wealth_ledger.api.exception;

import com.flagship.wealth_ledger.error.ErrorCategory;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Every error category maps to a distinct HTTP status")
    void statusPerCategory() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorCategory.VALIDATION));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorCategory.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorCategory.STATE_CONFLICT));
        assertEquals(HttpStatus.BAD_GATEWAY, GlobalExceptionHandler.statusFor(ErrorCategory.EXTERNAL_DEPENDENCY));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.statusFor(ErrorCategory.INTEGRITY));
    }

    @Test
    @DisplayName("Ledger exceptions carry their error code into the response body")
    void ledgerExceptionBody() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleLedgerException(
                new StateConflictException(LedgerErrorCode.INSUFFICIENT_FUNDS, "balance=10, requested=20"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals("INSUFFICIENT_FUNDS", response.getBody().getCode());
        assertEquals("balance=10, requested=20", response.getBody().getMessage());
        assertNotNull(response.getBody().getTimestamp());
    }

    @Test
    @DisplayName("Unexpected exceptions become a 500 without leaking the message")
    void unexpectedException() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleGenericException(new IllegalStateException("connection pool exhausted"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().getMessage());
    }
}

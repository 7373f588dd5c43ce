package com.flagship.wealth_ledger.sync;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ManualQuoteOracleTest {

    private static final Instant NOW = Instant.parse("2026-06-30T18:00:00Z");

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final ManualQuoteOracle oracle = new ManualQuoteOracle(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Quotes are stamped with the injected clock under the normalized symbol")
    void upsertUsesClock() {
        ManualQuoteOracle.Quote quote = oracle.upsert(" vti ", new BigDecimal("205.5"));

        assertEquals("VTI", quote.getSymbol());
        assertEquals(0, quote.getPrice().compareTo(new BigDecimal("205.5")));
        assertEquals(NOW, quote.getQuotedAt());
        verify(jdbcTemplate).update(anyString(), eq("VTI"), any(BigDecimal.class), eq(Timestamp.from(NOW)));
    }

    @Test
    @DisplayName("Non-positive quotes and blank symbols are rejected")
    void invalidQuotesRejected() {
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, assertThrows(ValidationException.class,
                () -> oracle.upsert("VTI", BigDecimal.ZERO)).getCode());
        assertEquals(LedgerErrorCode.INVALID_REQUEST, assertThrows(ValidationException.class,
                () -> oracle.upsert(" ", BigDecimal.ONE)).getCode());
        verifyNoInteractions(jdbcTemplate);
    }
}

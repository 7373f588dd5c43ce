package com.flagship.wealth_ledger.sync;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.ValidationException;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Price oracle backed by a hand-maintained quote book, e.g. fund NAVs
 * entered by the user.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManualQuoteOracle implements PriceOracle {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public Optional<BigDecimal> lookup(String symbol) {
        List<BigDecimal> prices = jdbcTemplate.queryForList(
            "SELECT price FROM manual_quotes WHERE symbol = ?",
            BigDecimal.class,
            normalize(symbol)
        );
        return prices.stream().findFirst();
    }

    /**
     * Inserts or replaces the quote for a symbol.
     */
    public Quote upsert(String symbol, BigDecimal price) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Symbol is required");
        }
        if (!MoneyMath.isPositive(price)) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT, "Quote price must be positive");
        }
        String key = normalize(symbol);
        BigDecimal canonical = MoneyMath.price(price);
        Instant quotedAt = Instant.now(clock);
        jdbcTemplate.update(
            "INSERT INTO manual_quotes (symbol, price, quoted_at) VALUES (?, ?, ?) " +
            "ON CONFLICT (symbol) DO UPDATE SET price = EXCLUDED.price, quoted_at = EXCLUDED.quoted_at",
            key,
            canonical,
            Timestamp.from(quotedAt)
        );
        log.info("Manual quote stored: symbol={}, price={}", key, canonical);
        return new Quote(key, canonical, quotedAt);
    }

    public boolean remove(String symbol) {
        return jdbcTemplate.update("DELETE FROM manual_quotes WHERE symbol = ?", normalize(symbol)) > 0;
    }

    public List<Quote> listQuotes() {
        return jdbcTemplate.query(
            "SELECT symbol, price, quoted_at FROM manual_quotes ORDER BY symbol",
            (rs, rowNum) -> new Quote(
                rs.getString("symbol"),
                rs.getBigDecimal("price"),
                rs.getTimestamp("quoted_at").toInstant()
            )
        );
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    @Value
    public static class Quote {
        String symbol;
        BigDecimal price;
        Instant quotedAt;
    }
}

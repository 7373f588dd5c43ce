package com.flagship.wealth_ledger.holding;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    @Test
    @DisplayName("A buy folds its fees into the average cost")
    void buyIncludesFeesInAverageCost() {
        Position position = Position.EMPTY.apply(TradeKind.BUY, d("100"), d("10"), d("5"));

        assertEquals(0, position.getQuantity().compareTo(d("100")));
        assertEquals(0, position.getAverageCost().compareTo(d("10.05")));
    }

    @Test
    @DisplayName("Successive buys produce a weighted average cost")
    void weightedAverageAcrossBuys() {
        Position position = Position.EMPTY
                .apply(TradeKind.BUY, d("100"), d("10"), d("5"))
                .apply(TradeKind.BUY, d("100"), d("12"), BigDecimal.ZERO);

        assertEquals(0, position.getQuantity().compareTo(d("200")));
        assertEquals(0, position.getAverageCost().compareTo(d("11.025")));
    }

    @Test
    @DisplayName("A sell reduces quantity and keeps the average cost")
    void sellKeepsAverageCost() {
        Position position = Position.of(d("150"), d("11.025"))
                .apply(TradeKind.SELL, d("50"), d("20"), d("1"));

        assertEquals(0, position.getQuantity().compareTo(d("100")));
        assertEquals(0, position.getAverageCost().compareTo(d("11.025")));
    }

    @Test
    @DisplayName("Selling the whole position leaves zero quantity")
    void sellToZero() {
        Position position = Position.of(d("10"), d("3")).apply(TradeKind.SELL, d("10"), d("4"), null);
        assertEquals(0, position.getQuantity().signum());
    }

    @Test
    @DisplayName("Selling more than is held is rejected")
    void oversellRejected() {
        Position position = Position.of(d("10"), d("3"));

        StateConflictException e = assertThrows(StateConflictException.class,
                () -> position.apply(TradeKind.SELL, d("10.00000001"), d("4"), null));
        assertEquals(LedgerErrorCode.INSUFFICIENT_HOLDING_QUANTITY, e.getCode());
    }

    @Test
    @DisplayName("Dividends and interest leave the position unchanged")
    void incomeDoesNotMovePosition() {
        Position position = Position.of(d("10"), d("3"));

        assertSame(position, position.apply(TradeKind.DIVIDEND, null, null, null));
        assertSame(position, position.apply(TradeKind.INTEREST, null, null, null));
    }

    @Test
    @DisplayName("Cash effect: buys cost q*p+fees, sells return q*p-fees, income returns amount-fees")
    void cashEffects() {
        assertEquals(0, HoldingStore.cashEffect(TradeKind.BUY, d("100"), d("10"), d("5"), null)
                .compareTo(d("-1005")));
        assertEquals(0, HoldingStore.cashEffect(TradeKind.SELL, d("50"), d("20"), d("1"), null)
                .compareTo(d("999")));
        assertEquals(0, HoldingStore.cashEffect(TradeKind.DIVIDEND, null, null, d("2"), d("30"))
                .compareTo(d("28")));
        assertEquals(0, HoldingStore.cashEffect(TradeKind.INTEREST, d("10"), d("0.5"), null, null)
                .compareTo(d("5")));
    }

    @Test
    @DisplayName("Trade validation rejects non-positive quantity or price for buys and sells")
    void validateRejectsBadShapes() {
        RecordTradeCommand zeroQuantity = RecordTradeCommand.builder()
                .symbol("AAPL").kind(TradeKind.BUY).quantity(BigDecimal.ZERO).price(d("10")).build();
        assertEquals(LedgerErrorCode.INVALID_AMOUNT,
                assertThrows(ValidationException.class, () -> HoldingStore.validate(zeroQuantity)).getCode());

        RecordTradeCommand negativeFees = RecordTradeCommand.builder()
                .symbol("AAPL").kind(TradeKind.SELL).quantity(d("1")).price(d("10")).fees(d("-1")).build();
        assertThrows(ValidationException.class, () -> HoldingStore.validate(negativeFees));

        RecordTradeCommand emptyDividend = RecordTradeCommand.builder()
                .symbol("AAPL").kind(TradeKind.DIVIDEND).build();
        assertThrows(ValidationException.class, () -> HoldingStore.validate(emptyDividend));

        RecordTradeCommand noSymbol = RecordTradeCommand.builder()
                .kind(TradeKind.BUY).quantity(d("1")).price(d("1")).build();
        assertEquals(LedgerErrorCode.INVALID_REQUEST,
                assertThrows(ValidationException.class, () -> HoldingStore.validate(noSymbol)).getCode());
    }

    @Test
    @DisplayName("Dividends and interest must pay out more than their fees")
    void incomeTradesNeedPositiveNet() {
        RecordTradeCommand feesEqualAmount = RecordTradeCommand.builder()
                .symbol("AAPL").kind(TradeKind.DIVIDEND).amount(d("30")).fees(d("30")).build();
        assertEquals(LedgerErrorCode.INVALID_AMOUNT,
                assertThrows(ValidationException.class, () -> HoldingStore.validate(feesEqualAmount)).getCode());

        RecordTradeCommand feesAboveAmount = RecordTradeCommand.builder()
                .symbol("BND").kind(TradeKind.INTEREST).amount(d("5")).fees(d("7.5")).build();
        assertEquals(LedgerErrorCode.INVALID_AMOUNT,
                assertThrows(ValidationException.class, () -> HoldingStore.validate(feesAboveAmount)).getCode());

        RecordTradeCommand netPositive = RecordTradeCommand.builder()
                .symbol("AAPL").kind(TradeKind.DIVIDEND).amount(d("30")).fees(d("2")).build();
        assertDoesNotThrow(() -> HoldingStore.validate(netPositive));
    }

    @Test
    @DisplayName("Symbols and markets are normalized to upper case")
    void normalization() {
        assertEquals("AAPL", HoldingStore.normalizeSymbol(" aapl "));
        assertEquals("NASDAQ", HoldingStore.normalizeMarket("nasdaq"));
        assertEquals("", HoldingStore.normalizeMarket(null));
    }
}

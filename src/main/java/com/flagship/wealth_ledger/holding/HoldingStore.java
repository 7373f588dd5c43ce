package com.flagship.wealth_ledger.holding;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.error.ValidationException;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns holding quantity, cost basis and market value.
 *
 * Cash is not touched here: the orchestrator debits or credits the owning
 * account with {@link #cashEffect} and journals it in the same unit of work.
 * All mutating methods require an open transaction and lock the holding row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldingStore {

    private static final String DEFAULT_MARKET = "";

    private final HoldingRepository holdingRepository;
    private final InvestmentTransactionRepository transactionRepository;

    /**
     * Signed cash effect of a trade on the owning account.
     *
     * buy: {@code -(q × p + fees)}; sell: {@code q × p - fees};
     * dividend and interest: {@code amount - fees}, amount defaulting to {@code q × p}.
     */
    public static BigDecimal cashEffect(TradeKind kind, BigDecimal quantity, BigDecimal price,
                                        BigDecimal fees, BigDecimal amount) {
        BigDecimal fee = MoneyMath.amount(fees);
        switch (kind) {
            case BUY:
                return MoneyMath.amount(MoneyMath.valueOf(quantity, price).add(fee).negate());
            case SELL:
                return MoneyMath.amount(MoneyMath.valueOf(quantity, price).subtract(fee));
            default:
                BigDecimal gross = amount != null ? MoneyMath.amount(amount) : MoneyMath.valueOf(quantity, price);
                return MoneyMath.amount(gross.subtract(fee));
        }
    }

    /**
     * Validates the numeric shape of a trade before anything is locked.
     */
    public static void validate(RecordTradeCommand command) {
        if (command.getKind() == null) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Trade kind is required");
        }
        if (command.getSymbol() == null || command.getSymbol().isBlank()) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Symbol is required");
        }
        BigDecimal fees = MoneyMath.requireNonNegative(command.getFees(), "fees");
        if (command.getKind().movesQuantity()) {
            if (!MoneyMath.isPositive(command.getQuantity())) {
                throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                        "quantity must be positive, got " + command.getQuantity());
            }
            if (!MoneyMath.isPositive(command.getPrice())) {
                throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                        "price must be positive, got " + command.getPrice());
            }
        } else {
            BigDecimal gross = command.getAmount() != null
                    ? command.getAmount()
                    : MoneyMath.valueOf(command.getQuantity(), command.getPrice());
            BigDecimal net = MoneyMath.requirePositive(gross, "amount").subtract(fees);
            if (net.signum() <= 0) {
                throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                        String.format("fees %s must be lower than the %s amount %s",
                                fees, command.getKind().name().toLowerCase(Locale.ROOT), gross));
            }
        }
    }

    public static String normalizeSymbol(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeMarket(String market) {
        return market == null ? DEFAULT_MARKET : market.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Registers an opening position. No cash moves and no trade is recorded.
     *
     * @throws StateConflictException DUPLICATE_HOLDING when an active holding
     *         with the same account, symbol, asset kind and market exists
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public HoldingEntity register(RegisterHoldingCommand command, String accountCurrency) {
        if (command.getSymbol() == null || command.getSymbol().isBlank() || command.getAssetKind() == null) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Symbol and asset kind are required");
        }
        String symbol = normalizeSymbol(command.getSymbol());
        String market = normalizeMarket(command.getMarket());
        BigDecimal quantity = MoneyMath.quantity(command.getQuantity());
        BigDecimal averageCost = MoneyMath.price(command.getAverageCost());
        if (quantity.signum() < 0 || averageCost.signum() < 0) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                    "quantity and average cost must not be negative");
        }
        if (command.getCurrentPrice() != null && command.getCurrentPrice().signum() < 0) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT, "current price must not be negative");
        }

        if (holdingRepository.findActiveForUpdate(command.getAccountId(), symbol, command.getAssetKind(), market)
                .isPresent()) {
            throw new StateConflictException(LedgerErrorCode.DUPLICATE_HOLDING,
                    String.format("Active holding %s (%s, market '%s') already exists in account %s",
                            symbol, command.getAssetKind(), market, command.getAccountId()));
        }

        HoldingEntity holding = HoldingEntity.open(
                command.getAccountId(), symbol, command.getName(), command.getAssetKind(), market,
                command.getCurrency() != null ? command.getCurrency() : accountCurrency,
                command.isLiquid(), Position.of(quantity, averageCost), command.getCurrentPrice());

        HoldingEntity saved = holdingRepository.save(holding);
        log.info("Holding registered: holdingId={}, symbol={}, quantity={}, liquid={}",
                saved.getId(), symbol, quantity, saved.isLiquid());
        return saved;
    }

    /**
     * Applies a trade to its holding and stores the transaction row.
     *
     * Buys open the holding when none is active. Sells require an active
     * holding with enough quantity. Dividends and interest attach to the
     * oldest active holding with the same symbol, if there is one.
     *
     * @param cashAmount signed cash effect, already computed by {@link #cashEffect}
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InvestmentTransactionEntity applyTrade(RecordTradeCommand command, BigDecimal cashAmount,
                                                  String accountCurrency, LocalDate tradeDate) {
        String symbol = normalizeSymbol(command.getSymbol());
        String market = normalizeMarket(command.getMarket());
        AssetKind assetKind = command.getAssetKind() != null ? command.getAssetKind() : AssetKind.STOCK;
        String currency = command.getCurrency() != null ? command.getCurrency() : accountCurrency;

        HoldingEntity holding;
        boolean holdingCreated = false;

        switch (command.getKind()) {
            case BUY: {
                Optional<HoldingEntity> existing =
                        holdingRepository.findActiveForUpdate(command.getAccountId(), symbol, assetKind, market);
                if (existing.isPresent()) {
                    holding = existing.get();
                } else {
                    holding = holdingRepository.save(HoldingEntity.open(
                            command.getAccountId(), symbol, command.getSymbolName(), assetKind, market,
                            currency, command.isLiquid(), Position.EMPTY, command.getPrice()));
                    holdingCreated = true;
                }
                break;
            }
            case SELL:
                holding = holdingRepository.findActiveForUpdate(command.getAccountId(), symbol, assetKind, market)
                        .orElseThrow(() -> new NotFoundException(LedgerErrorCode.HOLDING_NOT_FOUND,
                                String.format("No active %s holding of %s in account %s",
                                        assetKind, symbol, command.getAccountId())));
                break;
            default:
                holding = holdingRepository
                        .findByAccountIdAndSymbolAndActiveTrueOrderByCreatedAtAsc(command.getAccountId(), symbol)
                        .stream()
                        .findFirst()
                        .flatMap(h -> holdingRepository.findByIdForUpdate(h.getId()))
                        .orElse(null);
                break;
        }

        Position prior = holding != null ? holding.position() : Position.EMPTY;
        if (holding != null) {
            Position next = prior.apply(command.getKind(), command.getQuantity(), command.getPrice(), command.getFees());
            holding.moveTo(next, command.getPrice());
        }

        BigDecimal quantity = command.getQuantity() != null ? command.getQuantity() : BigDecimal.ZERO;
        BigDecimal price = command.getPrice() != null ? command.getPrice() : BigDecimal.ZERO;

        InvestmentTransactionEntity transaction = InvestmentTransactionEntity.record(
                command.getAccountId(), holding, command.getKind(), symbol,
                command.getSymbolName() != null ? command.getSymbolName() : (holding != null ? holding.getName() : null),
                holding != null ? holding.getAssetKind() : assetKind,
                holding != null ? holding.getMarket() : market,
                quantity, price, command.getFees(), cashAmount, prior, holdingCreated,
                tradeDate, currency, command.getNotes());

        InvestmentTransactionEntity saved = transactionRepository.save(transaction);
        log.debug("Trade applied: transactionId={}, kind={}, symbol={}, quantity={}, price={}, holdingId={}",
                saved.getId(), saved.getKind(), symbol, quantity, price, saved.getHoldingId());
        return saved;
    }

    /**
     * Removes a trade and restores its holding.
     *
     * The holding is rebuilt from the deleted trade's prior snapshot by
     * replaying every later trade of the same holding; the later trades'
     * snapshots are rewritten on the way. A holding opened by the deleted
     * trade with no later trades is deactivated.
     *
     * @throws StateConflictException INSUFFICIENT_HOLDING_QUANTITY when a
     *         later sell would no longer be covered
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<HoldingEntity> reverseTrade(InvestmentTransactionEntity trade) {
        if (trade.getHoldingId() == null) {
            transactionRepository.delete(trade);
            return Optional.empty();
        }

        HoldingEntity holding = holdingRepository.findByIdForUpdate(trade.getHoldingId())
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.HOLDING_NOT_FOUND,
                        "Holding", trade.getHoldingId()));

        List<InvestmentTransactionEntity> later = transactionRepository
                .findByHoldingIdOrderBySequenceNumberAsc(holding.getId())
                .stream()
                .filter(t -> t.getSequenceNumber() > trade.getSequenceNumber())
                .toList();

        Position position = trade.priorPosition();
        boolean createdFlag = trade.isHoldingCreated();
        for (InvestmentTransactionEntity next : later) {
            next.rebase(position, createdFlag);
            createdFlag = false;
            position = position.apply(next.getKind(), next.getQuantity(), next.getPrice(), next.getFees());
        }

        holding.moveTo(position, null);
        if (trade.isHoldingCreated() && later.isEmpty()) {
            holding.deactivate();
            log.info("Holding deactivated after its opening trade was deleted: holdingId={}", holding.getId());
        }

        transactionRepository.delete(trade);
        log.debug("Trade reversed: transactionId={}, holdingId={}, replayed={}, quantity={}, averageCost={}",
                trade.getId(), holding.getId(), later.size(), holding.getQuantity(), holding.getAverageCost());
        return Optional.of(holding);
    }

    /**
     * Writes a freshly looked-up price to one holding.
     *
     * @return the holding, or empty when it no longer exists or is inactive
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<HoldingEntity> updatePrice(UUID holdingId, BigDecimal price, Instant syncedAt) {
        Optional<HoldingEntity> locked = holdingRepository.findByIdForUpdate(holdingId)
                .filter(HoldingEntity::isActive);
        locked.ifPresent(h -> h.updatePrice(price, syncedAt));
        return locked;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public InvestmentTransactionEntity lockTransaction(UUID transactionId) {
        return transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.TRANSACTION_NOT_FOUND,
                        "Investment transaction", transactionId));
    }

    public InvestmentTransactionEntity getTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.TRANSACTION_NOT_FOUND,
                        "Investment transaction", transactionId));
    }

    public List<InvestmentTransactionEntity> transactions(UUID accountId) {
        return transactionRepository.findByAccountIdOrderBySequenceNumberAsc(accountId);
    }

    public List<HoldingEntity> activeHoldings(UUID accountId) {
        return holdingRepository.findByAccountIdAndActiveTrue(accountId);
    }

    public HoldingEntity get(UUID holdingId) {
        return holdingRepository.findById(holdingId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.HOLDING_NOT_FOUND, "Holding", holdingId));
    }
}

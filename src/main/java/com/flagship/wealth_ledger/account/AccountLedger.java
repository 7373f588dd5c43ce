package com.flagship.wealth_ledger.account;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingRepository;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Owns account balances and the values projected from them.
 *
 * Balance changes happen only on rows locked through {@link #lock} or
 * {@link #lockInOrder}. Callers append the matching journal entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLedger {

    private final AccountRepository accountRepository;
    private final HoldingRepository holdingRepository;

    /**
     * Locks an active account.
     *
     * @throws NotFoundException ACCOUNT_NOT_FOUND when it is missing or inactive
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountEntity lock(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .filter(AccountEntity::isActive)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account", accountId));
    }

    /**
     * Locks an account whether or not it is still active. Used when an
     * earlier operation is reversed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountEntity lockForReversal(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account", accountId));
    }

    /**
     * Locks several accounts in ascending id order, so that two operations
     * touching the same pair of accounts can never deadlock.
     *
     * @param includeInactive true when reversing, false for new activity
     * @return the locked accounts keyed by id, in the caller's order
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<UUID, AccountEntity> lockInOrder(Collection<UUID> accountIds, boolean includeInactive) {
        List<UUID> ordered = new ArrayList<>(accountIds.stream().distinct().toList());
        ordered.sort(Comparator.naturalOrder());

        Map<UUID, AccountEntity> locked = new LinkedHashMap<>();
        for (UUID id : ordered) {
            locked.put(id, includeInactive ? lockForReversal(id) : lock(id));
        }

        Map<UUID, AccountEntity> result = new LinkedHashMap<>();
        for (UUID id : accountIds) {
            result.put(id, locked.get(id));
        }
        return result;
    }

    /**
     * @return the balance after the credit
     */
    public BigDecimal credit(AccountEntity account, BigDecimal amount) {
        BigDecimal balance = account.credit(MoneyMath.amount(amount));
        log.debug("Account credited: accountId={}, amount={}, balance={}", account.getId(), amount, balance);
        return balance;
    }

    /**
     * @return the balance after the debit
     * @throws com.flagship.wealth_ledger.error.StateConflictException INSUFFICIENT_FUNDS
     */
    public BigDecimal debit(AccountEntity account, BigDecimal amount) {
        BigDecimal balance = account.debit(MoneyMath.amount(amount));
        log.debug("Account debited: accountId={}, amount={}, balance={}", account.getId(), amount, balance);
        return balance;
    }

    /**
     * Applies a signed delta: positive credits, negative debits.
     */
    public BigDecimal apply(AccountEntity account, BigDecimal delta) {
        return delta.signum() >= 0 ? credit(account, delta) : debit(account, delta.negate());
    }

    public ProjectedValues projectedValues(AccountEntity account) {
        return project(account.getBalance(), holdingRepository.findByAccountIdAndActiveTrue(account.getId()));
    }

    /**
     * Pure projection over a balance and the account's active holdings.
     */
    public static ProjectedValues project(BigDecimal balance, List<HoldingEntity> activeHoldings) {
        BigDecimal liquid = MoneyMath.ZERO_AMOUNT;
        BigDecimal nonLiquid = MoneyMath.ZERO_AMOUNT;
        for (HoldingEntity holding : activeHoldings) {
            if (!holding.isActive()) {
                continue;
            }
            if (holding.isLiquid()) {
                liquid = liquid.add(holding.getCurrentValue());
            } else {
                nonLiquid = nonLiquid.add(holding.getCurrentValue());
            }
        }
        BigDecimal cash = MoneyMath.amount(balance);
        return new ProjectedValues(
                MoneyMath.amount(cash.add(liquid).add(nonLiquid)),
                MoneyMath.amount(cash.add(liquid)),
                MoneyMath.amount(nonLiquid));
    }

    /**
     * Recomputes the {@code holdings_value} cache from the account's active
     * holdings. The account must already be locked.
     *
     * @return the new cached value
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal refreshHoldingsValue(AccountEntity account) {
        BigDecimal value = projectedValues(account).getInvestmentValue();
        account.refreshHoldingsValue(value);
        return value;
    }
}

package com.flagship.wealth_ledger.report;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountKind;
import com.flagship.wealth_ledger.account.AccountRepository;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingRepository;
import com.flagship.wealth_ledger.liability.LiabilityRepository;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Aggregates balances, holdings and liabilities into a net-worth view.
 *
 * Read-only; values are whatever the last trade or price sync left behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NetWorthService {

    private final AccountRepository accountRepository;
    private final HoldingRepository holdingRepository;
    private final LiabilityRepository liabilityRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public NetWorthSummary summarize() {
        BigDecimal cash = MoneyMath.ZERO_AMOUNT;
        BigDecimal investmentCash = MoneyMath.ZERO_AMOUNT;
        BigDecimal liquid = MoneyMath.ZERO_AMOUNT;
        BigDecimal nonLiquid = MoneyMath.ZERO_AMOUNT;

        List<AccountEntity> accounts = accountRepository.findByActiveTrueOrderByCreatedAtAsc();
        for (AccountEntity account : accounts) {
            if (account.getKind() == AccountKind.INVESTMENT) {
                investmentCash = investmentCash.add(account.getBalance());
            } else {
                cash = cash.add(account.getBalance());
            }
            for (HoldingEntity holding : holdingRepository.findByAccountIdAndActiveTrue(account.getId())) {
                if (holding.isLiquid()) {
                    liquid = liquid.add(holding.getCurrentValue());
                } else {
                    nonLiquid = nonLiquid.add(holding.getCurrentValue());
                }
            }
        }

        BigDecimal liabilities = MoneyMath.amount(liabilityRepository.sumActiveOutstandingPrincipal());
        BigDecimal assets = MoneyMath.amount(cash.add(investmentCash).add(liquid).add(nonLiquid));

        NetWorthSummary summary = NetWorthSummary.builder()
                .cashBalances(MoneyMath.amount(cash))
                .investmentCash(MoneyMath.amount(investmentCash))
                .liquidHoldings(MoneyMath.amount(liquid))
                .investmentValue(MoneyMath.amount(nonLiquid))
                .totalAssets(assets)
                .totalLiabilities(liabilities)
                .netWorth(MoneyMath.amount(assets.subtract(liabilities)))
                .activeAccounts(accounts.size())
                .calculatedAt(clock.instant())
                .build();

        log.debug("Net worth calculated: assets={}, liabilities={}, netWorth={}",
                assets, liabilities, summary.getNetWorth());
        return summary;
    }
}

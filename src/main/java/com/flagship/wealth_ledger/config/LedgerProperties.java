package com.flagship.wealth_ledger.config;

import com.flagship.wealth_ledger.holding.AssetKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Engine options bound from the {@code ledger.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Whether an expense may push a budget's remaining amount below zero.
     */
    private OverspendPolicy overspendPolicy = OverspendPolicy.ALLOW;

    /**
     * What happens when a liability payment exceeds the outstanding principal.
     */
    private OverpaymentPolicy overpaymentPolicy = OverpaymentPolicy.REJECT;

    /**
     * Whether deleting an expense linked to a completed or cancelled budget
     * still decrements that budget's spent amount.
     */
    private TerminalBudgetUnlink terminalBudgetUnlink = TerminalBudgetUnlink.ADJUST;

    /**
     * Run the post-mutation invariant checks before each unit of work commits.
     */
    private boolean integrityCheckEnabled = true;

    private Sync sync = new Sync();

    public enum OverspendPolicy {
        ALLOW,
        REJECT
    }

    public enum OverpaymentPolicy {
        CLAMP,
        REJECT
    }

    public enum TerminalBudgetUnlink {
        ADJUST,
        FREEZE
    }

    @Getter
    @Setter
    public static class Sync {

        /**
         * Asset kinds that keep their stored price and are never sent to the oracle.
         */
        private Set<AssetKind> excludedAssetKinds =
                EnumSet.of(AssetKind.BOND, AssetKind.MONEY_MARKET, AssetKind.CRYPTO);

        private Duration lookupTimeout = Duration.ofSeconds(5);

        private int lookupThreads = 4;

        private Scheduler scheduler = new Scheduler();
    }

    @Getter
    @Setter
    public static class Scheduler {

        private boolean enabled = false;

        private long intervalMs = 900_000L;
    }
}

package com.flagship.wealth_ledger.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncStatusTest {

    @Test
    @DisplayName("Status derives from updated and failed holding counts")
    void statusFromCounts() {
        assertEquals(SyncStatus.SUCCESS, SyncStatus.of(3, 0));
        assertEquals(SyncStatus.SUCCESS, SyncStatus.of(0, 0));
        assertEquals(SyncStatus.PARTIAL, SyncStatus.of(2, 1));
        assertEquals(SyncStatus.FAILED, SyncStatus.of(0, 4));
    }
}

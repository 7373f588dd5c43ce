package com.flagship.wealth_ledger.sync;

public enum SyncStatus {
    SUCCESS,
    PARTIAL,
    FAILED;

    /**
     * SUCCESS when nothing failed, FAILED when something failed and nothing
     * was updated, PARTIAL otherwise.
     */
    public static SyncStatus of(int succeeded, int failed) {
        if (failed == 0) {
            return SUCCESS;
        }
        return succeeded == 0 ? FAILED : PARTIAL;
    }
}

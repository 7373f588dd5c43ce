package com.flagship.wealth_ledger.liability;

public enum LiabilityKind {
    MORTGAGE,
    CAR_LOAN,
    CREDIT_CARD,
    PERSONAL_LOAN,
    STUDENT_LOAN,
    OTHER
}

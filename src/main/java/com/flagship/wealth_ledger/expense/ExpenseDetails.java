package com.flagship.wealth_ledger.expense;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Descriptive fields of an expense. None of them affect balances.
 */
@Value
@Builder
public class ExpenseDetails {
    String category;
    String subcategory;
    String merchant;
    String paymentMethod;
    boolean shared;
    List<String> tags;
    List<String> participants;
    String notes;
}

package com.flagship.wealth_ledger.expense;

import lombok.Value;

import java.util.List;

/**
 * A top-level category with its subcategories.
 */
@Value
public class ExpenseCategory {
    String category;
    List<String> subcategories;
}

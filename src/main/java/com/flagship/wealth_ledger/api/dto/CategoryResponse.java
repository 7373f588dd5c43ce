package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.expense.ExpenseCategory;
import lombok.Value;

import java.util.List;

@Value
public class CategoryResponse {

    @JsonProperty("category")
    String category;

    @JsonProperty("subcategories")
    List<String> subcategories;

    public static CategoryResponse from(ExpenseCategory category) {
        return new CategoryResponse(category.getCategory(), category.getSubcategories());
    }
}

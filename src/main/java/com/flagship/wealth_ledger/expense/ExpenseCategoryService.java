package com.flagship.wealth_ledger.expense;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the expense category reference data.
 */
@Service
@RequiredArgsConstructor
public class ExpenseCategoryService {

    private final JdbcTemplate jdbcTemplate;

    public List<ExpenseCategory> listCategories() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT category, subcategory FROM expense_categories ORDER BY category, sort_order, subcategory",
            rs -> {
                List<String> subcategories = grouped.computeIfAbsent(rs.getString("category"),
                        key -> new ArrayList<>());
                String subcategory = rs.getString("subcategory");
                if (subcategory != null) {
                    subcategories.add(subcategory);
                }
            }
        );

        List<ExpenseCategory> result = new ArrayList<>();
        grouped.forEach((category, subcategories) -> result.add(new ExpenseCategory(category, subcategories)));
        return result;
    }
}

package com.flagship.wealth_ledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wealth_ledger.account.AccountKind;
import com.flagship.wealth_ledger.api.dto.CreateAccountRequest;
import com.flagship.wealth_ledger.api.dto.CreateTransferRequest;
import com.flagship.wealth_ledger.api.dto.IncomeRequest;
import com.flagship.wealth_ledger.api.dto.RecordExpenseRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface: status codes, snake_case payloads and the error body.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class LedgerApiTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("wealth_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE TABLE cash_flow_entries, investment_transactions, holdings, "
                + "expense_tags, expense_participants, expenses, budget_accounts, budgets, transfers, "
                + "liability_payments, liabilities, market_sync_logs, manual_quotes, accounts CASCADE");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("  INPUT  " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("  OUTPUT " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private UUID createAccount(String name, AccountKind kind, String openingBalance) throws Exception {
        CreateAccountRequest request = CreateAccountRequest.builder()
                .name(name)
                .kind(kind)
                .currency("USD")
                .openingBalance(new BigDecimal(openingBalance))
                .build();

        MvcResult result = mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value(name))
                .andExpect(jsonPath("$.kind").value(kind.name()))
                .andReturn();
        return UUID.fromString(body(result).get("id").asText());
    }

    private void assertAmount(String expected, JsonNode node) {
        assertEquals(0, node.decimalValue().compareTo(new BigDecimal(expected)),
                "expected " + expected + " but was " + node);
    }

    @Test
    @DisplayName("Expense lifecycle over HTTP")
    void expenseLifecycle() throws Exception {
        printTestHeader("POST /api/expenses then DELETE");
        UUID accountId = createAccount("Checking", AccountKind.CASH, "1000");

        RecordExpenseRequest request = RecordExpenseRequest.builder()
                .accountId(accountId)
                .amount(new BigDecimal("42.50"))
                .category("Dining")
                .subcategory("Lunch")
                .merchant("Noodle Bar")
                .build();
        printInput("request", objectMapper.writeValueAsString(request));

        MvcResult created = mockMvc.perform(post("/api/expenses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.account_id").value(accountId.toString()))
                .andExpect(jsonPath("$.category").value("Dining"))
                .andReturn();
        String expenseId = body(created).get("id").asText();
        printOutput("expense", expenseId);

        MvcResult account = mockMvc.perform(get("/api/accounts/{id}", accountId))
                .andExpect(status().isOk())
                .andReturn();
        assertAmount("957.50", body(account).get("balance"));

        mockMvc.perform(delete("/api/expenses/{id}", expenseId))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/expenses/{id}", expenseId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("EXPENSE_NOT_FOUND"));

        MvcResult reconciliation = mockMvc.perform(get("/api/accounts/{id}/reconciliation", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanced").value(true))
                .andReturn();
        assertAmount("1000", body(reconciliation).get("stored_balance"));
        printSuccess("Expense created, deleted and reconciled");
    }

    @Test
    @DisplayName("Bean validation failures return 400 with field details")
    void validationFailure() throws Exception {
        printTestHeader("Invalid expense request");

        RecordExpenseRequest request = RecordExpenseRequest.builder()
                .amount(new BigDecimal("-5"))
                .build();

        mockMvc.perform(post("/api/expenses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.details.accountId").exists())
                .andExpect(jsonPath("$.details.amount").exists())
                .andExpect(jsonPath("$.details.category").exists());
        printSuccess("400 with per-field details");
    }

    @Test
    @DisplayName("Malformed JSON and bad path ids return 400")
    void malformedRequests() throws Exception {
        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/accounts/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown ids return 404 with the matching error code")
    void notFound() throws Exception {
        mockMvc.perform(get("/api/accounts/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));

        mockMvc.perform(get("/api/budgets/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BUDGET_NOT_FOUND"));
    }

    @Test
    @DisplayName("Business rule violations return 409")
    void conflicts() throws Exception {
        printTestHeader("409 responses");
        UUID source = createAccount("Checking", AccountKind.CASH, "100");
        UUID target = createAccount("Savings", AccountKind.CASH, "0");

        CreateTransferRequest transfer = CreateTransferRequest.builder()
                .fromAccountId(source)
                .toAccountId(target)
                .amount(new BigDecimal("150"))
                .build();

        mockMvc.perform(post("/api/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(transfer)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"));

        mockMvc.perform(delete("/api/accounts/{id}", source))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ACCOUNT_HAS_ACTIVITY"));

        mockMvc.perform(delete("/api/accounts/{id}", target))
                .andExpect(status().isNoContent());
        printSuccess("Conflicts mapped to 409");
    }

    @Test
    @DisplayName("Income and net worth endpoints")
    void incomeAndNetWorth() throws Exception {
        UUID accountId = createAccount("Checking", AccountKind.CASH, "0");

        IncomeRequest income = IncomeRequest.builder()
                .amount(new BigDecimal("3200"))
                .description("Salary")
                .build();

        mockMvc.perform(post("/api/accounts/{id}/income", accountId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(income)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entry_id").exists());

        MvcResult netWorth = mockMvc.perform(get("/api/net-worth"))
                .andExpect(status().isOk())
                .andReturn();
        assertAmount("3200", body(netWorth).get("net_worth"));

        mockMvc.perform(get("/api/accounts/{id}/entries", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("Seeded expense categories are listed")
    void categories() throws Exception {
        mockMvc.perform(get("/api/expenses/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].category").value("Dining"))
                .andExpect(jsonPath("$[0].subcategories").isArray());
    }
}

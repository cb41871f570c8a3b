package me.golemcore.support.adapter.outbound.store;

import me.golemcore.support.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.InvoiceRecord;
import me.golemcore.support.domain.model.SubscriptionRecord;
import me.golemcore.support.infrastructure.config.AutoConfiguration;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalAccountStoreAdapterTest {

    @TempDir
    Path tempDir;

    private LocalAccountStoreAdapter store;

    @BeforeEach
    void setUp() throws IOException {
        SupportProperties properties = new SupportProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new LocalAccountStoreAdapter(storage, properties, AutoConfiguration.objectMapper());

        Path accounts = tempDir.resolve("accounts");
        Files.writeString(accounts.resolve(LocalAccountStoreAdapter.CUSTOMERS_FILE), """
                [{"id": "cust-001", "email": "John.Smith@TechStartup.com", "firstName": "John",
                  "lastName": "Smith", "active": true, "createdAt": "2025-03-14T09:12:00Z"}]
                """);
        Files.writeString(accounts.resolve(LocalAccountStoreAdapter.SUBSCRIPTIONS_FILE), """
                [{"id": "sub-old", "customerId": "cust-001", "plan": "starter", "startDate": "2025-01-01"},
                 {"id": "sub-new", "customerId": "cust-001", "plan": "professional", "startDate": "2026-04-20",
                  "price": 49.00, "seats": 10},
                 {"id": "sub-other", "customerId": "cust-002", "plan": "starter", "startDate": "2026-05-01"}]
                """);
        Files.writeString(accounts.resolve(LocalAccountStoreAdapter.INVOICES_FILE), """
                [{"id": "inv-1", "customerId": "cust-001", "status": "paid", "total": 53.41,
                  "issueDate": "2026-09-18"},
                 {"id": "inv-2", "customerId": "cust-001", "status": "pending", "total": 53.41,
                  "issueDate": "2026-10-18", "unknownField": true}]
                """);
    }

    @Test
    void findCustomer_matchesEmailCaseInsensitively() {
        CustomerRecord customer = store.findCustomer("  john.smith@techstartup.com ").orElseThrow();

        assertEquals("cust-001", customer.getId());
        assertTrue(customer.isActive());
    }

    @Test
    void findCustomer_unknownOrBlankIsEmpty() {
        assertTrue(store.findCustomer("ghost@example.com").isEmpty());
        assertTrue(store.findCustomer(" ").isEmpty());
        assertTrue(store.findCustomer(null).isEmpty());
    }

    @Test
    void findSubscriptions_newestFirstForCustomerOnly() {
        List<SubscriptionRecord> subscriptions = store.findSubscriptions("cust-001");

        assertEquals(List.of("sub-new", "sub-old"), subscriptions.stream().map(SubscriptionRecord::getId).toList());
        assertEquals(0, new BigDecimal("49.00").compareTo(subscriptions.get(0).getPrice()));
    }

    @Test
    void findInvoices_newestFirst() {
        List<InvoiceRecord> invoices = store.findInvoices("cust-001");

        assertEquals(List.of("inv-2", "inv-1"), invoices.stream().map(InvoiceRecord::getId).toList());
        assertTrue(store.findInvoices("cust-404").isEmpty());
    }

    @Test
    void missingFileMeansNoRecords() throws IOException {
        Files.delete(tempDir.resolve("accounts").resolve(LocalAccountStoreAdapter.INVOICES_FILE));

        assertTrue(store.findInvoices("cust-001").isEmpty());
    }

    @Test
    void corruptedFileIsStorageUnavailable() throws IOException {
        Files.writeString(tempDir.resolve("accounts").resolve(LocalAccountStoreAdapter.CUSTOMERS_FILE), "[{oops");

        assertThrows(StorageUnavailableException.class, () -> store.findCustomer("john.smith@techstartup.com"));
    }
}

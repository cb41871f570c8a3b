package me.golemcore.support.port.outbound;

import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.InvoiceRecord;
import me.golemcore.support.domain.model.SubscriptionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to customer accounts. Callers pass a normalized email.
 */
public interface AccountStorePort {

    Optional<CustomerRecord> findCustomer(String email);

    /**
     * Subscriptions of a customer, most recent first.
     */
    List<SubscriptionRecord> findSubscriptions(String customerId);

    /**
     * Invoices of a customer, most recent first.
     */
    List<InvoiceRecord> findInvoices(String customerId);
}

package me.golemcore.support.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Invoice issued to a customer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceRecord {

    public static final String STATUS_PAID = "paid";
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_OVERDUE = "overdue";

    private String id;
    private String customerId;
    private String subscriptionId;
    private String invoiceNumber;
    private String status; // draft, pending, paid, overdue, cancelled, refunded
    private BigDecimal amount;
    private BigDecimal tax;
    private BigDecimal total;
    private String currency;
    private LocalDate issueDate;
    private LocalDate dueDate;
    private LocalDate paidDate;
    private String description;

    public boolean isOutstanding() {
        return STATUS_PENDING.equals(status) || STATUS_OVERDUE.equals(status);
    }
}

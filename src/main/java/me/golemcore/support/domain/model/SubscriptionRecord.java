package me.golemcore.support.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Subscription of a customer to a plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRecord {

    private String id;
    private String customerId;
    private String plan; // free, starter, professional, enterprise
    private String status; // active, trial, past_due, cancelled, paused
    private String billingCycle; // monthly, annual
    private BigDecimal price;
    private LocalDate startDate;
    private LocalDate endDate;
    private LocalDate trialEndDate;
    private int seats;
    private List<String> features;
}

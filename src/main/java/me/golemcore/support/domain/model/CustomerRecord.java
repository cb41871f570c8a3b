package me.golemcore.support.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Customer profile from the account store. Email is the lookup key and is
 * stored lower-cased.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRecord {

    private String id;
    private String email;
    private String firstName;
    private String lastName;
    private String company;
    private String phone;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    public String getFullName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }
}

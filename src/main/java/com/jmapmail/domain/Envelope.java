package com.jmapmail.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SMTP envelope in its JMAP wire form
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Envelope {

    private Address mailFrom;

    @Builder.Default
    private List<Address> rcptTo = new ArrayList<>();

    @JsonIgnore
    public List<String> getRecipientEmails() {
        List<String> emails = new ArrayList<>();
        if (rcptTo != null) {
            for (Address address : rcptTo) {
                if (address != null && address.getEmail() != null && !address.getEmail().isBlank()) {
                    emails.add(address.getEmail().trim());
                }
            }
        }
        return emails;
    }

    /**
     * A usable envelope has a MAIL FROM and at least one RCPT TO
     */
    @JsonIgnore
    public boolean isValid() {
        return mailFrom != null
                && mailFrom.getEmail() != null
                && !mailFrom.getEmail().isBlank()
                && !getRecipientEmails().isEmpty();
    }

    public static Envelope of(String mailFrom, List<String> recipients) {
        List<Address> rcpt = new ArrayList<>();
        for (String recipient : recipients) {
            rcpt.add(new Address(recipient, null));
        }
        return new Envelope(new Address(mailFrom, null), rcpt);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Address {
        private String email;
        private Map<String, String> parameters;
    }
}

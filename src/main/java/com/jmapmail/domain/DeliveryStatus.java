package com.jmapmail.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery status of one recipient of a submission
 * - smtpReply: "250 2.0.0 Accepted" style reply line
 * - delivered / displayed: JMAP delivery and read-receipt state
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryStatus {

    private Integer code;
    private String enhancedStatus;
    private String reason;
    private String smtpReply;
    private Delivered delivered;
    private Displayed displayed;
    private String providerMessageId;
    private String providerRequestId;

    public static DeliveryStatus of(int code, String enhancedStatus, String reason, Delivered delivered) {
        return DeliveryStatus.builder()
                .code(code)
                .enhancedStatus(enhancedStatus)
                .reason(reason)
                .smtpReply(code + " " + enhancedStatus + " " + reason)
                .delivered(delivered)
                .displayed(Displayed.UNKNOWN)
                .build();
    }

    public enum Delivered {
        QUEUED, YES, NO, UNKNOWN;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Delivered fromJson(String value) {
            return value == null ? UNKNOWN : valueOf(value.trim().toUpperCase());
        }
    }

    public enum Displayed {
        UNKNOWN, YES;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Displayed fromJson(String value) {
            return value == null ? UNKNOWN : valueOf(value.trim().toUpperCase());
        }
    }
}

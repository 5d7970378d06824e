package com.jmapmail.outbound;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transport verdict for one send
 * - ACCEPTED: taken over by the next hop
 * - REJECTED: refused; permanent decides whether a retry makes sense
 * - FAILED: the transport could not complete the attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundResult {

    public enum Status {
        ACCEPTED, REJECTED, FAILED
    }

    private Status status;
    private boolean permanent;
    private String providerMessageId;
    private String providerRequestId;
    private String reason;

    public static OutboundResult accepted(String providerMessageId, String reason) {
        return OutboundResult.builder()
                .status(Status.ACCEPTED)
                .providerMessageId(providerMessageId)
                .reason(reason)
                .build();
    }

    public static OutboundResult rejected(boolean permanent, String reason) {
        return OutboundResult.builder()
                .status(Status.REJECTED)
                .permanent(permanent)
                .reason(reason)
                .build();
    }

    public static OutboundResult failed(String reason) {
        return OutboundResult.builder()
                .status(Status.FAILED)
                .reason(reason)
                .build();
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public boolean isPermanentRejection() {
        return status == Status.REJECTED && permanent;
    }
}

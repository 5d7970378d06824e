package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Address occurrence in a message header (from, sender, reply-to, to, cc, bcc)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageAddress {

    private String messageId;
    private String addressId;
    private String kind;
    private int position;
    private String email;   // joined from address
    private String name;    // display name as written in this message
}

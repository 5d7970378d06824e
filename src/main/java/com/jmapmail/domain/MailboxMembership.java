package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MailboxMembership {

    private String accountMessageId;
    private String mailboxId;
}

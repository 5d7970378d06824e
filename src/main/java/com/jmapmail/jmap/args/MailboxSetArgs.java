package com.jmapmail.jmap.args;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class MailboxSetArgs extends SetArgs<MailboxCreate> {

    private boolean onDestroyRemoveEmails;
}

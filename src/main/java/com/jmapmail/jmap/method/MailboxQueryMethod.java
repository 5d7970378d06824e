package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.MailboxQueryArgs;
import com.jmapmail.service.MailboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MailboxQueryMethod implements JmapMethod<MailboxQueryArgs> {

    private final MailboxService mailboxService;

    @Override
    public String name() {
        return "Mailbox/query";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<MailboxQueryArgs> argumentType() {
        return MailboxQueryArgs.class;
    }

    @Override
    public Object handle(MailboxQueryArgs args, InvocationContext context) {
        return mailboxService.query(context.getAccountId(), args);
    }
}

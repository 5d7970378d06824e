package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.MailboxSetArgs;
import com.jmapmail.service.MailboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MailboxSetMethod implements JmapMethod<MailboxSetArgs> {

    private final MailboxService mailboxService;

    @Override
    public String name() {
        return "Mailbox/set";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<MailboxSetArgs> argumentType() {
        return MailboxSetArgs.class;
    }

    @Override
    public Object handle(MailboxSetArgs args, InvocationContext context) {
        return mailboxService.set(context.getAccountId(), args, context);
    }
}

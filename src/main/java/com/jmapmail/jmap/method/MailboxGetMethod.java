package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.service.MailboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MailboxGetMethod implements JmapMethod<GetArgs> {

    private final MailboxService mailboxService;

    @Override
    public String name() {
        return "Mailbox/get";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<GetArgs> argumentType() {
        return GetArgs.class;
    }

    @Override
    public Object handle(GetArgs args, InvocationContext context) {
        return mailboxService.get(context.getAccountId(), args);
    }
}

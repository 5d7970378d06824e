package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.EmailCopyArgs;
import com.jmapmail.service.EmailCopyService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailCopyMethod implements JmapMethod<EmailCopyArgs> {

    private final EmailCopyService emailCopyService;

    @Override
    public String name() {
        return "Email/copy";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<EmailCopyArgs> argumentType() {
        return EmailCopyArgs.class;
    }

    @Override
    public Object handle(EmailCopyArgs args, InvocationContext context) {
        return emailCopyService.copy(context.getAccountId(), args, context);
    }
}

package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.EmailSetArgs;
import com.jmapmail.service.EmailSetService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailSetMethod implements JmapMethod<EmailSetArgs> {

    private final EmailSetService emailSetService;

    @Override
    public String name() {
        return "Email/set";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<EmailSetArgs> argumentType() {
        return EmailSetArgs.class;
    }

    @Override
    public Object handle(EmailSetArgs args, InvocationContext context) {
        return emailSetService.set(context.getAccountId(), args, context);
    }
}

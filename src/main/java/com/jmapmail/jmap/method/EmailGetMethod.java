package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.EmailGetArgs;
import com.jmapmail.service.EmailQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailGetMethod implements JmapMethod<EmailGetArgs> {

    private final EmailQueryService emailQueryService;

    @Override
    public String name() {
        return "Email/get";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<EmailGetArgs> argumentType() {
        return EmailGetArgs.class;
    }

    @Override
    public Object handle(EmailGetArgs args, InvocationContext context) {
        return emailQueryService.getEmails(context.getAccountId(), args);
    }
}

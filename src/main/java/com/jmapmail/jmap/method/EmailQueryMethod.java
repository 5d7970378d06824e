package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.EmailQueryArgs;
import com.jmapmail.service.EmailQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailQueryMethod implements JmapMethod<EmailQueryArgs> {

    private final EmailQueryService emailQueryService;

    @Override
    public String name() {
        return "Email/query";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<EmailQueryArgs> argumentType() {
        return EmailQueryArgs.class;
    }

    @Override
    public Object handle(EmailQueryArgs args, InvocationContext context) {
        return emailQueryService.query(context.getAccountId(), args);
    }
}

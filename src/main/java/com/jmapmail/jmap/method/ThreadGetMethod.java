package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.service.EmailQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ThreadGetMethod implements JmapMethod<GetArgs> {

    private final EmailQueryService emailQueryService;

    @Override
    public String name() {
        return "Thread/get";
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
        return emailQueryService.getThreads(context.getAccountId(), args);
    }
}

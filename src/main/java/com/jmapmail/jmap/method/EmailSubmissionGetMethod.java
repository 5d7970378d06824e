package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.service.SubmissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailSubmissionGetMethod implements JmapMethod<GetArgs> {

    private final SubmissionService submissionService;

    @Override
    public String name() {
        return "EmailSubmission/get";
    }

    @Override
    public String capability() {
        return JmapCapabilities.SUBMISSION;
    }

    @Override
    public Class<GetArgs> argumentType() {
        return GetArgs.class;
    }

    @Override
    public Object handle(GetArgs args, InvocationContext context) {
        return submissionService.get(context.getAccountId(), args);
    }
}

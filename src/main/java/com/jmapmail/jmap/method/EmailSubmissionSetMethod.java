package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.EmailSubmissionSetArgs;
import com.jmapmail.service.SubmissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailSubmissionSetMethod implements JmapMethod<EmailSubmissionSetArgs> {

    private final SubmissionService submissionService;

    @Override
    public String name() {
        return "EmailSubmission/set";
    }

    @Override
    public String capability() {
        return JmapCapabilities.SUBMISSION;
    }

    @Override
    public Class<EmailSubmissionSetArgs> argumentType() {
        return EmailSubmissionSetArgs.class;
    }

    @Override
    public Object handle(EmailSubmissionSetArgs args, InvocationContext context) {
        return submissionService.set(context.getAccountId(), args, context);
    }
}

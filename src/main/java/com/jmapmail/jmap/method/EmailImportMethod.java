package com.jmapmail.jmap.method;

import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.EmailImportArgs;
import com.jmapmail.service.EmailImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailImportMethod implements JmapMethod<EmailImportArgs> {

    private final EmailImportService emailImportService;

    @Override
    public String name() {
        return "Email/import";
    }

    @Override
    public String capability() {
        return JmapCapabilities.MAIL;
    }

    @Override
    public Class<EmailImportArgs> argumentType() {
        return EmailImportArgs.class;
    }

    @Override
    public Object handle(EmailImportArgs args, InvocationContext context) {
        return emailImportService.importEmails(context.getAccountId(), args, context);
    }
}

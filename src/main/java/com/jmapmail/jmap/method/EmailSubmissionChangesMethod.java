package com.jmapmail.jmap.method;

import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.service.ChangeLogService;
import org.springframework.stereotype.Component;

@Component
public class EmailSubmissionChangesMethod extends ChangesMethod {

    public EmailSubmissionChangesMethod(ChangeLogService changeLogService) {
        super(changeLogService, JmapType.EMAIL_SUBMISSION, JmapCapabilities.SUBMISSION, false);
    }
}

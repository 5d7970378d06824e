package com.jmapmail.jmap.method;

import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.service.ChangeLogService;
import org.springframework.stereotype.Component;

/**
 * Mailbox/changes; reports updatedProperties when every update in the window carried them
 */
@Component
public class MailboxChangesMethod extends ChangesMethod {

    public MailboxChangesMethod(ChangeLogService changeLogService) {
        super(changeLogService, JmapType.MAILBOX, JmapCapabilities.MAIL, true);
    }
}

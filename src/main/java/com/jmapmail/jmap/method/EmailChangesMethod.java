package com.jmapmail.jmap.method;

import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.service.ChangeLogService;
import org.springframework.stereotype.Component;

@Component
public class EmailChangesMethod extends ChangesMethod {

    public EmailChangesMethod(ChangeLogService changeLogService) {
        super(changeLogService, JmapType.EMAIL, JmapCapabilities.MAIL, false);
    }
}

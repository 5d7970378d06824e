package com.jmapmail.jmap.method;

import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.JmapCapabilities;
import com.jmapmail.service.ChangeLogService;
import org.springframework.stereotype.Component;

@Component
public class ThreadChangesMethod extends ChangesMethod {

    public ThreadChangesMethod(ChangeLogService changeLogService) {
        super(changeLogService, JmapType.THREAD, JmapCapabilities.MAIL, false);
    }
}

package com.jmapmail.outbound;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * dnsjava MX lookup using the system resolver configuration
 */
@Slf4j
@Component
public class DnsMxResolver implements MxResolver {

    @Override
    public List<String> resolve(String domain) {
        List<String> hosts = new ArrayList<>();
        try {
            Record[] records = new Lookup(domain, Type.MX).run();
            if (records != null) {
                Arrays.stream(records)
                        .filter(MXRecord.class::isInstance)
                        .map(MXRecord.class::cast)
                        .sorted(Comparator.comparingInt(MXRecord::getPriority))
                        .map(mx -> mx.getTarget().toString(true))
                        .filter(host -> !host.isEmpty() && !".".equals(host))
                        .forEach(hosts::add);
            }
        } catch (TextParseException e) {
            log.warn("Invalid domain for MX lookup: {}", domain);
        }

        // implicit MX (RFC 5321 5.1)
        if (hosts.isEmpty()) {
            hosts.add(domain);
        }
        log.debug("MX hosts for {}: {}", domain, hosts);
        return hosts;
    }
}

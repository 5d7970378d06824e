package com.jmapmail.outbound;

import java.util.List;

/**
 * Resolves the SMTP hosts that accept mail for a domain, most preferred first
 */
public interface MxResolver {

    List<String> resolve(String domain);
}

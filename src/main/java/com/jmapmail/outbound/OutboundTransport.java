package com.jmapmail.outbound;

/**
 * Provider-agnostic outbound mail transport.
 * Infrastructure failures (connection refused, timeouts) are thrown; protocol verdicts are returned.
 */
public interface OutboundTransport {

    OutboundResult send(OutboundRequest request) throws Exception;
}

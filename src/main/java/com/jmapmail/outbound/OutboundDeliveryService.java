package com.jmapmail.outbound;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs transport sends off the caller's thread.
 * The caller always waits for the transport's own verdict: an attempt is never reported
 * as finished while the send may still be in progress. Deadlines are enforced by the
 * transport's socket timeouts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboundDeliveryService {

    private final OutboundTransport transport;

    /**
     * Send through the transport (Reactive); errors are signalled, never swallowed
     */
    public Mono<OutboundResult> deliver(OutboundRequest request) {
        return Mono.fromCallable(() -> transport.send(request))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("Submission {} transport result: {}",
                        request.getSubmissionId(), result == null ? null : result.getStatus()))
                .doOnError(e -> log.warn("Submission {} transport error: {}",
                        request.getSubmissionId(), e.toString()));
    }

    /**
     * Blocking form used by the queue; the transaction-free send path waits here
     */
    public OutboundResult deliverBlocking(OutboundRequest request) {
        OutboundResult result = deliver(request).block();
        if (result == null) {
            throw new IllegalStateException("Transport returned no result");
        }
        return result;
    }
}

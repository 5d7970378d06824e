package com.jmapmail.outbound;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * OutboundDeliveryService unit tests
 */
@ExtendWith(MockitoExtension.class)
class OutboundDeliveryServiceTest {

    @Mock
    private OutboundTransport transport;

    private OutboundDeliveryService deliveryService;

    @BeforeEach
    void setUp() {
        deliveryService = new OutboundDeliveryService(transport);
    }

    private static OutboundRequest request() {
        return OutboundRequest.builder()
                .submissionId("S1")
                .mailFrom("me@example.com")
                .rcptTo(List.of("you@remote.org"))
                .build();
    }

    @Test
    @DisplayName("Transport verdict is returned as is")
    void testDeliver() throws Exception {
        when(transport.send(any(OutboundRequest.class))).thenReturn(OutboundResult.accepted("q1", "250 ok"));

        OutboundResult result = deliveryService.deliverBlocking(request());

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getProviderMessageId()).isEqualTo("q1");
    }

    @Test
    @DisplayName("Transport exceptions propagate to the caller")
    void testTransportError() throws Exception {
        when(transport.send(any(OutboundRequest.class))).thenThrow(new jakarta.mail.MessagingException("Connection refused"));

        assertThatThrownBy(() -> deliveryService.deliverBlocking(request()))
                .hasRootCauseMessage("Connection refused");
    }

    @Test
    @DisplayName("A slow send is awaited; the verdict is never reported before the message went out")
    void testSlowSendIsAwaited() throws Exception {
        AtomicInteger delivered = new AtomicInteger();
        when(transport.send(any(OutboundRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(400);
            delivered.incrementAndGet();
            return OutboundResult.accepted("late", "250 ok");
        });

        OutboundResult result = deliveryService.deliverBlocking(request());

        assertThat(delivered.get()).isEqualTo(1);
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getProviderMessageId()).isEqualTo("late");
    }
}

package com.jmapmail.jmap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.jmap.method.MailboxGetMethod;
import com.jmapmail.service.ChangeLogService;
import com.jmapmail.service.MailboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * JmapMethodDispatcher unit tests
 */
@ExtendWith(MockitoExtension.class)
class JmapMethodDispatcherTest {

    private static final String ACCOUNT = "acc";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ChangeLogService changeLogService;

    @Mock
    private MailboxService mailboxService;

    private ServerProperties properties;
    private JmapMethodDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new ServerProperties();
        dispatcher = new JmapMethodDispatcher(List.of(new MailboxGetMethod(mailboxService)),
                changeLogService, objectMapper, properties);
    }

    private static JmapRequest request(List<String> using, Invocation... calls) {
        JmapRequest request = new JmapRequest();
        request.setUsing(using);
        request.setMethodCalls(new ArrayList<>(List.of(calls)));
        return request;
    }

    private static Map<String, Object> args(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static Map<String, Object> mailbox(String id) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        return map;
    }

    @Test
    @DisplayName("Core/echo returns its arguments unchanged")
    void testEcho() {
        when(changeLogService.getSessionState(ACCOUNT)).thenReturn("7");

        JmapResponse response = dispatcher.dispatch(request(List.of(JmapCapabilities.CORE),
                new Invocation("Core/echo", args("hello", true), "c1")), ACCOUNT);

        assertThat(response.getSessionState()).isEqualTo("7");
        assertThat(response.getMethodResponses()).hasSize(1);
        assertThat(response.getMethodResponses().get(0).getName()).isEqualTo("Core/echo");
        assertThat(response.getMethodResponses().get(0).getArguments()).isEqualTo(args("hello", true));
        assertThat(response.getMethodResponses().get(0).getMethodCallId()).isEqualTo("c1");
    }

    @Test
    @DisplayName("Unknown method yields an error response and the batch continues")
    void testUnknownMethod() {
        JmapResponse response = dispatcher.dispatch(request(List.of(JmapCapabilities.CORE),
                new Invocation("Foo/bar", args(), "c1"),
                new Invocation("Core/echo", args("x", 1), "c2")), ACCOUNT);

        Invocation error = response.getMethodResponses().get(0);
        assertThat(error.getName()).isEqualTo("error");
        assertThat(((Map<?, ?>) error.getArguments()).get("type")).isEqualTo(JmapErrorType.UNKNOWN_METHOD);
        assertThat(response.getMethodResponses().get(1).getName()).isEqualTo("Core/echo");
    }

    @Test
    @DisplayName("A method whose capability is not in using is unknownMethod")
    void testCapabilityNotUsed() {
        JmapResponse response = dispatcher.dispatch(request(List.of(JmapCapabilities.CORE),
                new Invocation("Mailbox/get", args("accountId", ACCOUNT), "c1")), ACCOUNT);

        assertThat(((Map<?, ?>) response.getMethodResponses().get(0).getArguments()).get("type"))
                .isEqualTo(JmapErrorType.UNKNOWN_METHOD);
    }

    @Test
    @DisplayName("Unsupported capability rejects the whole request")
    void testUnknownCapability() {
        JmapRequest request = request(List.of(JmapCapabilities.CORE, "urn:example:unknown"),
                new Invocation("Core/echo", args(), "c1"));

        assertThatThrownBy(() -> dispatcher.dispatch(request, ACCOUNT))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.UNKNOWN_CAPABILITY);
    }

    @Test
    @DisplayName("More calls than maxCallsInRequest is a limit error")
    void testTooManyCalls() {
        properties.getLimits().setMaxCallsInRequest(1);
        JmapRequest request = request(List.of(JmapCapabilities.CORE),
                new Invocation("Core/echo", args(), "c1"),
                new Invocation("Core/echo", args(), "c2"));

        assertThatThrownBy(() -> dispatcher.dispatch(request, ACCOUNT))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.LIMIT);
    }

    @Test
    @DisplayName("Result reference with /list/*/id collects ids of a previous response")
    void testResultReference() {
        when(mailboxService.get(eq(ACCOUNT), any(GetArgs.class)))
                .thenReturn(new GetResponse(ACCOUNT, "1", List.of(mailbox("mb1"), mailbox("mb2")), List.of()));

        JmapResponse response = dispatcher.dispatch(request(
                List.of(JmapCapabilities.CORE, JmapCapabilities.MAIL),
                new Invocation("Mailbox/get", args("accountId", ACCOUNT), "c1"),
                new Invocation("Core/echo", args("#ids",
                        args("resultOf", "c1", "name", "Mailbox/get", "path", "/list/*/id")), "c2")), ACCOUNT);

        assertThat(response.getMethodResponses().get(1).getArguments())
                .isEqualTo(args("ids", List.of("mb1", "mb2")));
    }

    @Test
    @DisplayName("Reference to a missing call is invalidResultReference")
    void testBadReference() {
        JmapResponse response = dispatcher.dispatch(request(List.of(JmapCapabilities.CORE),
                new Invocation("Core/echo", args("#ids",
                        args("resultOf", "nope", "name", "Mailbox/get", "path", "/ids")), "c1")), ACCOUNT);

        assertThat(((Map<?, ?>) response.getMethodResponses().get(0).getArguments()).get("type"))
                .isEqualTo(JmapErrorType.INVALID_RESULT_REFERENCE);
    }

    @Test
    @DisplayName("accountId of another account is accountNotFound")
    void testForeignAccount() {
        JmapResponse response = dispatcher.dispatch(request(
                List.of(JmapCapabilities.CORE, JmapCapabilities.MAIL),
                new Invocation("Mailbox/get", args("accountId", "other"), "c1")), ACCOUNT);

        assertThat(((Map<?, ?>) response.getMethodResponses().get(0).getArguments()).get("type"))
                .isEqualTo(JmapErrorType.ACCOUNT_NOT_FOUND);
    }

    @Test
    @DisplayName("JSON pointer: escapes, array index and flattened wildcard")
    void testEvaluatePointer() throws Exception {
        JsonNode root = objectMapper.readTree(
                "{\"a/b\":1,\"list\":[{\"ids\":[\"x\",\"y\"]},{\"ids\":[\"z\"]}]}");

        assertThat(dispatcher.evaluatePointer(root, "/a~1b").asInt()).isEqualTo(1);
        assertThat(dispatcher.evaluatePointer(root, "/list/1/ids/0").asText()).isEqualTo("z");
        assertThat(dispatcher.evaluatePointer(root, "/list/*/ids").toString()).isEqualTo("[\"x\",\"y\",\"z\"]");
        assertThat(dispatcher.evaluatePointer(root, "/missing")).isNull();
    }
}

package com.jmapmail.jmap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.jmap.args.MethodArgs;
import com.jmapmail.service.ChangeLogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JMAP request processing
 * - Request-level checks (capabilities, call count) throw; the controller answers 400
 * - Each method call runs on its own; an error becomes an "error" response and the batch continues
 * - "#name" arguments are resolved from earlier responses (result references)
 * - Implicit responses (Email/set after copy or submission) follow the call that caused them
 */
@Slf4j
@Service
public class JmapMethodDispatcher {

    static final String CORE_ECHO = "Core/echo";

    private final Map<String, JmapMethod<?>> methods = new HashMap<>();
    private final ChangeLogService changeLogService;
    private final ObjectMapper objectMapper;
    private final ServerProperties properties;

    public JmapMethodDispatcher(List<JmapMethod<?>> handlers,
                                ChangeLogService changeLogService,
                                ObjectMapper objectMapper,
                                ServerProperties properties) {
        for (JmapMethod<?> handler : handlers) {
            methods.put(handler.name(), handler);
        }
        this.changeLogService = changeLogService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        log.info("JMAP methods registered: {}", methods.keySet());
    }

    public JmapResponse dispatch(JmapRequest request, String accountId) {
        validate(request);
        InvocationContext context = new InvocationContext(accountId, request.getCreatedIds());
        List<Invocation> responses = new ArrayList<>();

        for (Invocation call : request.getMethodCalls()) {
            String tag = call.getMethodCallId();
            try {
                Object result = invoke(call, request.getUsing(), responses, context);
                responses.add(new Invocation(call.getName(), result, tag));
                for (Invocation implicit : context.takeImplicitResponses()) {
                    responses.add(new Invocation(implicit.getName(), implicit.getArguments(), tag));
                }
            } catch (JmapException e) {
                context.takeImplicitResponses();
                responses.add(error(e.getType(), e.getMessage(), tag));
            } catch (Exception e) {
                context.takeImplicitResponses();
                log.error("JMAP method {} failed", call.getName(), e);
                responses.add(error(JmapErrorType.SERVER_ERROR, "Internal server error", tag));
            }
        }

        return new JmapResponse(responses,
                request.getCreatedIds() == null ? null : context.getCreatedIds(),
                changeLogService.getSessionState(accountId));
    }

    void validate(JmapRequest request) {
        if (request == null || request.getUsing() == null || request.getMethodCalls() == null) {
            throw new JmapException(JmapErrorType.NOT_REQUEST, "Request must contain using and methodCalls");
        }
        for (String capability : request.getUsing()) {
            if (!JmapCapabilities.SUPPORTED.contains(capability)) {
                throw new JmapException(JmapErrorType.UNKNOWN_CAPABILITY, "Unsupported capability: " + capability);
            }
        }
        int maxCalls = properties.getLimits().getMaxCallsInRequest();
        if (request.getMethodCalls().size() > maxCalls) {
            throw new JmapException(JmapErrorType.LIMIT, "Too many method calls, maximum is " + maxCalls);
        }
    }

    private Object invoke(Invocation call, List<String> using, List<Invocation> responses,
                          InvocationContext context) {
        Map<String, Object> rawArgs = resolveReferences(asArguments(call.getArguments()), responses);
        if (CORE_ECHO.equals(call.getName())) {
            return rawArgs;
        }

        JmapMethod<?> method = methods.get(call.getName());
        if (method == null || !using.contains(method.capability())) {
            throw new JmapException(JmapErrorType.UNKNOWN_METHOD, "Unknown method: " + call.getName());
        }
        return invokeTyped(method, rawArgs, context);
    }

    private <A extends MethodArgs> Object invokeTyped(JmapMethod<A> method, Map<String, Object> rawArgs,
                                                      InvocationContext context) {
        A args;
        try {
            args = objectMapper.convertValue(rawArgs, method.argumentType());
        } catch (IllegalArgumentException e) {
            throw JmapException.invalidArguments("Invalid arguments for " + method.name() + ": "
                    + rootMessage(e));
        }
        if (args.getAccountId() != null && !args.getAccountId().equals(context.getAccountId())) {
            throw new JmapException(JmapErrorType.ACCOUNT_NOT_FOUND, "Account not found: " + args.getAccountId());
        }
        return method.handle(args, context);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asArguments(Object arguments) {
        if (arguments == null) {
            return new LinkedHashMap<>();
        }
        if (!(arguments instanceof Map)) {
            throw JmapException.invalidArguments("Method arguments must be an object");
        }
        return new LinkedHashMap<>((Map<String, Object>) arguments);
    }

    /**
     * Replace every "#key": {resultOf, name, path} with the referenced value under "key"
     */
    Map<String, Object> resolveReferences(Map<String, Object> arguments, List<Invocation> responses) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith("#")) {
                resolved.put(key, entry.getValue());
                continue;
            }
            String target = key.substring(1);
            if (arguments.containsKey(target)) {
                throw JmapException.invalidArguments("Both " + target + " and " + key + " are present");
            }
            resolved.put(target, resolveReference(entry.getValue(), responses));
        }
        return resolved;
    }

    private Object resolveReference(Object reference, List<Invocation> responses) {
        JsonNode ref = objectMapper.valueToTree(reference);
        String resultOf = ref.path("resultOf").asText(null);
        String name = ref.path("name").asText(null);
        String path = ref.path("path").asText(null);
        if (resultOf == null || name == null || path == null) {
            throw new JmapException(JmapErrorType.INVALID_RESULT_REFERENCE, "Result reference needs resultOf, name and path");
        }

        Invocation source = null;
        for (Invocation response : responses) {
            if (resultOf.equals(response.getMethodCallId())) {
                source = response;
                break;
            }
        }
        if (source == null || !name.equals(source.getName())) {
            throw new JmapException(JmapErrorType.INVALID_RESULT_REFERENCE,
                    "No " + name + " response with id " + resultOf);
        }

        JsonNode value = evaluatePointer(objectMapper.valueToTree(source.getArguments()), path);
        if (value == null) {
            throw new JmapException(JmapErrorType.INVALID_RESULT_REFERENCE, "Path " + path + " not found");
        }
        return objectMapper.convertValue(value, Object.class);
    }

    /**
     * JSON pointer where "*" maps over array elements or object values; nested array results are flattened
     * @return null when the path does not exist
     */
    JsonNode evaluatePointer(JsonNode root, String path) {
        if (path.isEmpty() || "/".equals(path)) {
            return root;
        }
        if (!path.startsWith("/")) {
            return null;
        }
        String[] tokens = path.substring(1).split("/", -1);
        return evaluate(root, tokens, 0);
    }

    private JsonNode evaluate(JsonNode node, String[] tokens, int index) {
        if (index == tokens.length) {
            return node;
        }
        if (node == null) {
            return null;
        }
        String token = tokens[index].replace("~1", "/").replace("~0", "~");
        if ("*".equals(token)) {
            if (!node.isArray() && !node.isObject()) {
                return null;
            }
            ArrayNode collected = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                JsonNode value = evaluate(element, tokens, index + 1);
                if (value == null) {
                    return null;
                }
                if (value.isArray()) {
                    collected.addAll((ArrayNode) value);
                } else {
                    collected.add(value);
                }
            }
            return collected;
        }
        if (node.isArray()) {
            try {
                return evaluate(node.get(Integer.parseInt(token)), tokens, index + 1);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return node.isObject() ? evaluate(node.get(token), tokens, index + 1) : null;
    }

    private Invocation error(JmapErrorType type, String description, String tag) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        body.put("description", description);
        return new Invocation("error", body, tag);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        int newline = message == null ? -1 : message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : String.valueOf(message);
    }
}

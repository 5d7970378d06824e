package com.jmapmail.jmap;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class JmapRequest {

    private List<String> using;
    private List<Invocation> methodCalls;
    private Map<String, String> createdIds;
}

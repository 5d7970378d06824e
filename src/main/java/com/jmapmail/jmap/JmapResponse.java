package com.jmapmail.jmap;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JmapResponse {

    private List<Invocation> methodResponses;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, String> createdIds;

    private String sessionState;
}

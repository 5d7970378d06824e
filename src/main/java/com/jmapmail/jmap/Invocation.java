package com.jmapmail.jmap;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One method call or response: serialized as [name, arguments, methodCallId]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "arguments", "methodCallId"})
public class Invocation {

    private String name;
    private Object arguments;
    private String methodCallId;
}

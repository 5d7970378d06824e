package com.jmapmail.jmap;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SetError {

    private JmapErrorType type;
    private String description;
    private List<String> properties;

    public static SetError of(JmapErrorType type, String description) {
        return new SetError(type, description, null);
    }
}

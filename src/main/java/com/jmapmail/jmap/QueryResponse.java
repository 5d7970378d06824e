package com.jmapmail.jmap;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
public class QueryResponse {

    private String accountId;
    private String queryState;
    private boolean canCalculateChanges;
    private int position;
    private List<String> ids;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer total;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer limit;
}

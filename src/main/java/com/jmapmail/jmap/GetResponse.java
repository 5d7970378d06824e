package com.jmapmail.jmap;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GetResponse {

    private String accountId;
    private String state;
    private List<Map<String, Object>> list;
    private List<String> notFound;
}

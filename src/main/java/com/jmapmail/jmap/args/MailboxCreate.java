package com.jmapmail.jmap.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailboxCreate {

    private String name;
    private String parentId;
    private String role;
    private Integer sortOrder;

    @JsonProperty("isSubscribed")
    private Boolean isSubscribed;
}

package com.jmapmail.jmap;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jmapmail.service.ChangeLogService;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
public class ChangesResponse {

    private String accountId;
    private String oldState;
    private String newState;
    private boolean hasMoreChanges;
    private List<String> created;
    private List<String> updated;
    private List<String> destroyed;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> updatedProperties;

    public static ChangesResponse of(String accountId, ChangeLogService.ChangeSet changes) {
        ChangesResponse response = new ChangesResponse();
        response.setAccountId(accountId);
        response.setOldState(changes.getOldState());
        response.setNewState(changes.getNewState());
        response.setHasMoreChanges(changes.isHasMoreChanges());
        response.setCreated(changes.getCreated());
        response.setUpdated(changes.getUpdated());
        response.setDestroyed(changes.getDestroyed());
        response.setUpdatedProperties(changes.getUpdatedProperties());
        return response;
    }
}

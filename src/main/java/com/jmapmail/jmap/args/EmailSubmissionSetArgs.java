package com.jmapmail.jmap.args;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Map;

/**
 * EmailSubmission/set arguments; onSuccess* keys are submission ids or #creationIds
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class EmailSubmissionSetArgs extends SetArgs<EmailSubmissionCreate> {

    private Map<String, Map<String, Object>> onSuccessUpdateEmail;
    private List<String> onSuccessDestroyEmail;
}

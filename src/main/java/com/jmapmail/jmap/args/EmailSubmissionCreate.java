package com.jmapmail.jmap.args;

import com.jmapmail.domain.Envelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailSubmissionCreate {

    private String emailId;
    private String identityId;
    private Envelope envelope;
    private Instant sendAt;
}

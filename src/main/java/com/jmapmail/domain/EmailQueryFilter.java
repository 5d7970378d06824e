package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Criteria for listing account messages (Email/query)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailQueryFilter {

    private String accountId;
    private String inMailbox;
    private String inThread;
    private String hasKeyword;      // custom keyword, lowercase
    private String notKeyword;
    private String hasFlag;         // seen, flagged, answered or draft column
    private String notFlag;
    private String text;            // LIKE pattern on subject / snippet
    private boolean ascending;
    private int offset;
    private int limit;
}

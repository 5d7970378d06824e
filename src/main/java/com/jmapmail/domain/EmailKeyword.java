package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailKeyword {

    private String accountMessageId;
    private String keyword;
}

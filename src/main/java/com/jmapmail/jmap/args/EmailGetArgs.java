package com.jmapmail.jmap.args;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class EmailGetArgs extends GetArgs {

    private boolean fetchTextBodyValues;
    private boolean fetchHTMLBodyValues;
    private boolean fetchAllBodyValues;
    private Integer maxBodyValueBytes;
}

package com.jmapmail.jmap.args;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class EmailQueryArgs extends MethodArgs {

    private Filter filter;
    private List<Comparator> sort;
    private int position;
    private Integer limit;
    private boolean calculateTotal;
    private boolean collapseThreads;

    @Data
    @NoArgsConstructor
    public static class Filter {
        private String inMailbox;
        private String inThread;
        private String hasKeyword;
        private String notKeyword;
        private String text;
    }

    @Data
    @NoArgsConstructor
    public static class Comparator {
        private String property;
        private Boolean isAscending;
    }
}

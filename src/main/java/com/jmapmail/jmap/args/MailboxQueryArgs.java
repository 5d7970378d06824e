package com.jmapmail.jmap.args;

import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class MailboxQueryArgs extends MethodArgs {

    private Filter filter;
    private List<Comparator> sort;
    private int position;
    private Integer limit;
    private boolean calculateTotal;
    private boolean sortAsTree;
    private boolean filterAsTree;

    @Data
    @NoArgsConstructor
    public static class Filter {
        /**
         * An explicit null selects top-level mailboxes, so presence is tracked separately
         */
        @Setter(AccessLevel.NONE)
        private String parentId;
        @Setter(AccessLevel.NONE)
        private boolean parentIdPresent;
        private String name;
        private String role;
        private Boolean hasAnyRole;
        private Boolean isSubscribed;

        public void setParentId(String parentId) {
            this.parentId = parentId;
            this.parentIdPresent = true;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Comparator {
        private String property;
        private Boolean isAscending;
    }
}

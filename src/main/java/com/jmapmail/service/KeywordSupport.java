package com.jmapmail.service;

import com.jmapmail.jmap.JmapException;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * JMAP keyword handling
 * - Four well-known flags map to account_message columns
 * - Everything else is a custom keyword row
 */
public final class KeywordSupport {

    public static final String SEEN = "$seen";
    public static final String FLAGGED = "$flagged";
    public static final String ANSWERED = "$answered";
    public static final String DRAFT = "$draft";

    private static final int MAX_KEYWORD_LENGTH = 255;

    private KeywordSupport() {}

    /**
     * Lowercased keyword with IMAP system flags (\Seen) mapped to their JMAP names
     */
    public static String normalize(String keyword) {
        if (keyword == null) {
            throw JmapException.invalidProperties("Keyword must not be null", "keywords");
        }
        String value = keyword.trim();
        if (value.startsWith("\\")) {
            value = "$" + value.substring(1);
        }
        value = value.toLowerCase(Locale.ROOT);
        validate(value);
        return value;
    }

    /**
     * Printable ASCII without spaces or IMAP specials, at most 255 characters
     */
    public static void validate(String keyword) {
        if (keyword.isEmpty() || keyword.length() > MAX_KEYWORD_LENGTH) {
            throw JmapException.invalidProperties("Invalid keyword length: " + keyword, "keywords");
        }
        for (int i = 0; i < keyword.length(); i++) {
            char c = keyword.charAt(i);
            if (c <= 0x20 || c >= 0x7f || "(){]%*\"\\".indexOf(c) >= 0) {
                throw JmapException.invalidProperties("Invalid keyword: " + keyword, "keywords");
            }
        }
    }

    public static boolean isFlag(String normalized) {
        return SEEN.equals(normalized) || FLAGGED.equals(normalized)
                || ANSWERED.equals(normalized) || DRAFT.equals(normalized);
    }

    /**
     * Split a keyword set into flags and custom keywords
     */
    public static Split split(Map<String, Boolean> keywords) {
        Split split = new Split();
        if (keywords == null) {
            return split;
        }
        for (Map.Entry<String, Boolean> entry : keywords.entrySet()) {
            if (!Boolean.TRUE.equals(entry.getValue())) {
                throw JmapException.invalidProperties("Keyword values must be true", "keywords");
            }
            String keyword = normalize(entry.getKey());
            switch (keyword) {
                case SEEN -> split.seen = true;
                case FLAGGED -> split.flagged = true;
                case ANSWERED -> split.answered = true;
                case DRAFT -> split.draft = true;
                default -> split.custom.add(keyword);
            }
        }
        return split;
    }

    /**
     * JMAP keywords object from flags and custom rows
     */
    public static Map<String, Boolean> toJmap(boolean seen, boolean flagged, boolean answered, boolean draft,
                                              Iterable<String> custom) {
        Map<String, Boolean> keywords = new LinkedHashMap<>();
        if (seen) keywords.put(SEEN, true);
        if (flagged) keywords.put(FLAGGED, true);
        if (answered) keywords.put(ANSWERED, true);
        if (draft) keywords.put(DRAFT, true);
        if (custom != null) {
            for (String keyword : custom) {
                keywords.put(keyword, true);
            }
        }
        return keywords;
    }

    @Getter
    public static class Split {
        private boolean seen;
        private boolean flagged;
        private boolean answered;
        private boolean draft;
        private final Set<String> custom = new LinkedHashSet<>();
    }
}

package com.jmapmail.service;

import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * KeywordSupport unit tests
 */
class KeywordSupportTest {

    @Test
    @DisplayName("Keywords are lowercased and IMAP system flags map to $ names")
    void testNormalize() {
        assertThat(KeywordSupport.normalize("$Seen")).isEqualTo("$seen");
        assertThat(KeywordSupport.normalize("\\Flagged")).isEqualTo("$flagged");
        assertThat(KeywordSupport.normalize("Work")).isEqualTo("work");
    }

    @Test
    @DisplayName("Spaces and IMAP specials are rejected as invalidProperties")
    void testInvalidKeyword() {
        assertThatThrownBy(() -> KeywordSupport.normalize("two words"))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.INVALID_PROPERTIES);
        assertThatThrownBy(() -> KeywordSupport.normalize("bad(paren"))
                .isInstanceOf(JmapException.class);
        assertThatThrownBy(() -> KeywordSupport.normalize(""))
                .isInstanceOf(JmapException.class);
    }

    @Test
    @DisplayName("split separates the four flags from custom keywords")
    void testSplit() {
        Map<String, Boolean> keywords = new LinkedHashMap<>();
        keywords.put("$seen", true);
        keywords.put("$Draft", true);
        keywords.put("Project-X", true);

        KeywordSupport.Split split = KeywordSupport.split(keywords);

        assertThat(split.isSeen()).isTrue();
        assertThat(split.isDraft()).isTrue();
        assertThat(split.isFlagged()).isFalse();
        assertThat(split.getCustom()).containsExactly("project-x");
    }

    @Test
    @DisplayName("Keyword values other than true are rejected")
    void testFalseValue() {
        Map<String, Boolean> keywords = new LinkedHashMap<>();
        keywords.put("$seen", false);

        assertThatThrownBy(() -> KeywordSupport.split(keywords))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.INVALID_PROPERTIES);
    }

    @Test
    @DisplayName("toJmap lists flags first, then custom keywords")
    void testToJmap() {
        Map<String, Boolean> keywords = KeywordSupport.toJmap(true, false, true, false, List.of("work"));

        assertThat(keywords).containsExactly(
                Map.entry("$seen", true), Map.entry("$answered", true), Map.entry("work", true));
    }
}

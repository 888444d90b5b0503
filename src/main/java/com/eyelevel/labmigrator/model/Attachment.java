package com.eyelevel.labmigrator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.web.util.HtmlUtils;

/**
 * A binary file that goes to the experiment's uploads. Fragments refer to it through
 * {@link #placeholderAttribute()} until the upload returns a download location.
 */
@Getter
@Builder
@ToString(exclude = "content")
public class Attachment {

    private static final String PLACEHOLDER_FORMAT = "{{attachment:%s}}";

    private final String fileName;
    private final String mimeType;
    private final byte[] content;

    public String placeholder() {
        return placeholderFor(fileName);
    }

    /**
     * The placeholder as it appears inside a quoted {@code href} or {@code src} attribute.
     */
    public String placeholderAttribute() {
        return attributeValue(placeholder());
    }

    public static String placeholderFor(String fileName) {
        return PLACEHOLDER_FORMAT.formatted(fileName);
    }

    /**
     * Escapes a value for a double-quoted HTML attribute.
     */
    public static String attributeValue(String value) {
        return HtmlUtils.htmlEscape(value, "UTF-8");
    }
}

package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * A {@code FILE} attachment reference.
 *
 * @param src SRC attribute, empty when absent
 * @param preview PREVIEW attribute, null when absent
 * @param type Type attribute, null when absent
 * @param title title attribute, null when absent
 */
public record FileReference(String src, String preview, String type, String title) implements ContentNode {

    public FileReference {
        src = Objects.requireNonNullElse(src, "");
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.FILE_REFERENCE;
    }
}

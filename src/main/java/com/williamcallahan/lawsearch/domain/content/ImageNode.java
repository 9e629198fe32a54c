package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * An {@code IMG} element. Only {@code src} is guaranteed; every other attribute is null when absent.
 */
public record ImageNode(
        String src,
        String alt,
        String title,
        String orient,
        String position,
        String align,
        String size,
        String width,
        String height,
        String units,
        String type)
        implements ContentNode {

    public ImageNode {
        src = Objects.requireNonNullElse(src, "");
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.IMAGE;
    }
}

package com.williamcallahan.lawsearch.domain.norm;

import com.williamcallahan.lawsearch.domain.content.TableOfContents;
import java.util.List;
import java.util.Objects;

/**
 * A {@code text} or {@code fussnoten} block.
 *
 * @param format format attribute, for example "XML"
 * @param tableOfContents TOC child, null when absent
 * @param content Content child, null when absent
 * @param footnotes Footnote entries of the Footnotes child, empty when absent
 */
public record NormText(String format, TableOfContents tableOfContents, TextBody content, List<Footnote> footnotes) {

    public NormText {
        footnotes = List.copyOf(Objects.requireNonNull(footnotes, "footnotes"));
    }
}

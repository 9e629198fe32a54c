package com.williamcallahan.lawsearch.domain.content;

/**
 * One node of a parsed norm text.
 *
 * <p>The hierarchy is closed: every variant is a record listed in {@code permits}, and composite
 * variants own their children as an ordered list of the same type. Child order mirrors source
 * order and is relied on by rendering and positional section lookup.</p>
 */
public sealed interface ContentNode
        permits TextRun,
                ParagraphNode,
                DefinitionList,
                TableNode,
                ImageNode,
                FileReference,
                FootnoteArea,
                TableOfContents,
                CommentNode,
                PreformattedText,
                FormatSpan,
                RevisionBlock {

    /**
     * Returns the discriminant for this node.
     *
     * @return node kind, never null
     */
    ContentNodeKind kind();
}

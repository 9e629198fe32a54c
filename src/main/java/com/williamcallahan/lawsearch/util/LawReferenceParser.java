package com.williamcallahan.lawsearch.util;

import com.williamcallahan.lawsearch.domain.reference.ParsedReference;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses German legal citations into structured coordinates.
 * Recognizes forms like "§ 8b Absatz 2", "Art. 1 Abs. 2", "BGB § 1 Absatz 1 Satz 1" and
 * "§ 10 Abs. 1 Nr. 4 Buchstabe a", also when they are embedded in running text.
 */
public final class LawReferenceParser {
    private LawReferenceParser() {}

    private static final String SPACE = "[\\s\\u00A0]"; // published texts use no-break spaces after "§"

    /**
     * Citation grammar. Keywords are case-insensitive; the law code, the paragraph letter and the
     * Buchstabe letter are matched case-sensitively.
     *
     * <p>A paragraph token directly followed by a further letter ("8bc") does not match at that
     * position. For "Buchstaben a und b" or "Buchstaben a bis c" only the first letter is kept.</p>
     */
    private static final Pattern REFERENCE_PATTERN = Pattern.compile(
            "(?:\\b((?-i:[A-Z][A-Za-z]*[A-Z]|[A-Z]{2,}))" + SPACE + "+)?" // law code: BGB, GmbHG, KStG
                    + "(?:§|Artikel|Art\\.?)" + SPACE + "*" // paragraph marker
                    + "((?-i:\\d++[a-z]?+))(?![A-Za-z])" // paragraph: 52, 8b
                    + "(?:" + SPACE + "+(?:Absatz|Abs\\.?)" + SPACE + "+(\\d+))?"
                    + "(?:" + SPACE + "+(?:Nummer|Nr\\.?)" + SPACE + "+(\\d+))?"
                    + "(?:" + SPACE + "+Buchstaben?" + SPACE + "+((?-i:[a-z])))?"
                    + "(?:" + SPACE + "+Satz" + SPACE + "+(\\d+))?",
            Pattern.CASE_INSENSITIVE);

    private static final int LAW_GROUP = 1;
    private static final int PARAGRAPH_GROUP = 2;
    private static final int SECTION_GROUP = 3;
    private static final int NUMBER_GROUP = 4;
    private static final int LETTER_GROUP = 5;
    private static final int SENTENCE_GROUP = 6;

    /**
     * Parse the first citation found anywhere in the text.
     *
     * @param reference citation text, possibly embedded in prose
     * @return parsed reference, empty when the text contains no citation
     */
    public static Optional<ParsedReference> parse(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(reference);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedReference(
                matcher.group(LAW_GROUP),
                matcher.group(PARAGRAPH_GROUP),
                matcher.group(SECTION_GROUP),
                matcher.group(NUMBER_GROUP),
                matcher.group(LETTER_GROUP),
                matcher.group(SENTENCE_GROUP)));
    }

    /**
     * Extract only the law code of the first citation, when it names one.
     *
     * @param reference citation text
     * @return law code such as "KStG", empty when absent or when no citation is found
     */
    public static Optional<String> extractLawCode(String reference) {
        return parse(reference).flatMap(ParsedReference::lawCode);
    }
}

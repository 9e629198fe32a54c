package com.williamcallahan.lawsearch.domain.norm;

/**
 * The {@code textdaten} block of a norm.
 *
 * @param text main text, null when absent
 * @param footnoteText fussnoten block, null when absent
 */
public record NormTextData(NormText text, NormText footnoteText) {}

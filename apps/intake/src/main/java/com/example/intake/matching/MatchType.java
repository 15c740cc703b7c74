package com.example.intake.matching;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchType {

    /** Every query token found verbatim, or the identifier equals the query. */
    EXACT,

    /** At least one query token matched only by edit-distance similarity. */
    FUZZY,

    /** The identifier ends with the queried digits, or shares a long enough trailing run with them. */
    IDENTIFIER_SUFFIX,

    /** The identifier contains the queried digits somewhere other than its end. */
    IDENTIFIER_SUBSTRING,

    /** Blank query; the candidate was returned without filtering. */
    UNFILTERED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}

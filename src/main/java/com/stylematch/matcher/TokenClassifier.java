package com.stylematch.matcher;

import com.stylematch.syntax.DataType;

/**
 * Classifies value tokens of one representation for the {@link StyleMatcher}.
 *
 * @param <T> Token representation
 */
public interface TokenClassifier<T> {

    /**
     * Check whether a token belongs to a data type.
     *
     * @param token    Token to classify
     * @param dataType Requested data type
     * @return true if the token is a valid value of that type
     */
    boolean matchesDataType(T token, DataType dataType);

    /**
     * Check whether a token is the given keyword, ignoring case.
     */
    boolean matchesKeyword(T token, String keyword);

    /**
     * Check whether a token is a variable reference whose value is unknown at validation time.
     */
    boolean isVariable(T token);

    /**
     * Check whether a token is a comma separator.
     */
    boolean isComma(T token);

    /**
     * Check whether a token is accepted by every property regardless of its syntax.
     */
    boolean isUnconditional(T token);

    /**
     * Render a token for diagnostics.
     */
    String describe(T token);
}

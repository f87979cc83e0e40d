package com.stylematch.matcher;

import java.util.Optional;

/**
 * Result of a {@link StyleMatcher#match} call.
 *
 * @param errorCode     NONE on success
 * @param errorValue    Offending token, or null
 * @param consumedCount Number of tokens consumed when matching stopped
 * @param variableCount Number of tokens accepted as variable references
 * @param <T>           Token representation
 */
public record MatchResult<T>(
        MatchResultErrorCode errorCode,
        T errorValue,
        int consumedCount,
        int variableCount
) {
    public static <T> MatchResult<T> ok(int consumedCount, int variableCount) {
        return new MatchResult<>(MatchResultErrorCode.NONE, null, consumedCount, variableCount);
    }

    public static <T> MatchResult<T> emptyValue() {
        return new MatchResult<>(MatchResultErrorCode.EMPTY_VALUE, null, 0, 0);
    }

    public static <T> MatchResult<T> syntaxError(T errorValue, int consumedCount, int variableCount) {
        return new MatchResult<>(MatchResultErrorCode.SYNTAX, errorValue, consumedCount, variableCount);
    }

    public static <T> MatchResult<T> expectedEndOfValue(T errorValue, int consumedCount, int variableCount) {
        return new MatchResult<>(MatchResultErrorCode.EXPECTED_END_OF_VALUE, errorValue, consumedCount,
                variableCount);
    }

    public boolean isSuccess() {
        return errorCode == MatchResultErrorCode.NONE;
    }

    public Optional<T> offendingToken() {
        return Optional.ofNullable(errorValue);
    }
}

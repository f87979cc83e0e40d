package com.stylematch.matcher;

import com.stylematch.syntax.Expression;
import com.stylematch.syntax.ExpressionMultiplier;
import com.stylematch.syntax.ExpressionType;
import com.stylematch.syntax.MultiplierType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Backtracking matcher that checks a token sequence against a syntax tree.
 * <p>
 * The algorithm is written once against {@link TokenClassifier}; one instance is
 * created per token representation. All per-call state lives in a {@link MatchCursor}
 * created by {@link #match}, so an instance can be reused and shared.
 * <p>
 * Variable references are treated optimistically: a variable token satisfies any
 * leaf, and once a variable has been matched, running out of tokens is not a failure
 * since the variable may expand to whatever is still missing.
 *
 * @param <T> Token representation
 */
public class StyleMatcher<T> {

    private static final Logger log = LoggerFactory.getLogger(StyleMatcher.class);

    private final TokenClassifier<T> classifier;

    public StyleMatcher(TokenClassifier<T> classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public TokenClassifier<T> getClassifier() {
        return classifier;
    }

    /**
     * Match a token sequence against a syntax tree.
     *
     * @param root   Parsed syntax
     * @param tokens Value tokens
     * @return Match result; the tree is never modified
     */
    public MatchResult<T> match(Expression root, List<T> tokens) {
        Objects.requireNonNull(root, "root");
        if (tokens == null || tokens.isEmpty()) {
            return MatchResult.emptyValue();
        }

        MatchCursor<T> cursor = new MatchCursor<>(tokens);

        // 'initial' and env() are accepted by every property
        boolean matched;
        if (classifier.isUnconditional(cursor.current())) {
            cursor.moveNext();
            matched = true;
        } else {
            matched = match(root, cursor);
        }

        if (cursor.markDepth() != 0) {
            throw new IllegalStateException("Unbalanced marks after match: " + cursor.markDepth());
        }
        if (!matched) {
            log.debug("No match for {} at token {} of {}", root, cursor.index(), tokens.size());
            return MatchResult.syntaxError(cursor.current(), cursor.index(), cursor.variableCount());
        }
        if (cursor.hasCurrent()) {
            return MatchResult.expectedEndOfValue(cursor.current(), cursor.index(), cursor.variableCount());
        }
        return MatchResult.ok(cursor.index(), cursor.variableCount());
    }

    private boolean match(Expression exp, MatchCursor<T> cursor) {
        boolean result = exp.multiplier().isNone()
                ? matchExpression(exp, cursor)
                : matchExpressionWithMultiplier(exp, cursor);

        if (!result && !cursor.hasCurrent() && cursor.variableCount() > 0) {
            result = true;
        }
        return result;
    }

    private boolean matchExpressionWithMultiplier(Expression exp, MatchCursor<T> cursor) {
        ExpressionMultiplier multiplier = exp.multiplier();
        boolean commaSeparated = multiplier.type() == MultiplierType.COMMA_LIST;

        int mark = cursor.mark();
        int matchCount = 0;
        while (cursor.hasCurrent() && matchCount < multiplier.max()) {
            int before = cursor.index();

            if (commaSeparated && matchCount > 0) {
                if (!classifier.isComma(cursor.current())) {
                    break;
                }
                int separator = cursor.mark();
                cursor.moveNext();
                if (!cursor.hasCurrent() || !matchExpression(exp, cursor)) {
                    cursor.restore(separator);
                    break;
                }
                cursor.drop(separator);
            } else if (!matchExpression(exp, cursor)) {
                break;
            }

            matchCount++;
            if (cursor.index() == before) {
                // zero-width repetition, every further one would match the same way
                matchCount = Math.max(matchCount, multiplier.min());
                break;
            }
        }

        boolean result = matchCount >= multiplier.min() && matchCount <= multiplier.max();
        if (!result && !cursor.hasCurrent() && cursor.variableCount() > 0) {
            // the variable may expand to the missing repetitions
            result = true;
        }
        if (result) {
            cursor.drop(mark);
        } else {
            cursor.restore(mark);
        }
        return result;
    }

    private boolean matchExpression(Expression exp, MatchCursor<T> cursor) {
        if (exp.type() == ExpressionType.COMBINATOR) {
            return matchCombinator(exp, cursor);
        }
        if (!cursor.hasCurrent()) {
            return false;
        }

        T current = cursor.current();
        boolean result;
        if (classifier.isVariable(current)) {
            cursor.countVariable();
            result = true;
        } else if (exp.type() == ExpressionType.DATA) {
            result = classifier.matchesDataType(current, exp.dataType());
        } else {
            result = classifier.matchesKeyword(current, exp.keyword());
        }

        if (result) {
            cursor.moveNext();
        }
        return result;
    }

    private boolean matchCombinator(Expression exp, MatchCursor<T> cursor) {
        int mark = cursor.mark();

        boolean result = switch (exp.combinator()) {
            case OR -> matchOr(exp, cursor);
            case OR_OR -> matchOrOr(exp, cursor);
            case AND_AND -> matchAndAnd(exp, cursor);
            case JUXTAPOSITION -> matchJuxtaposition(exp, cursor);
            case GROUP -> match(exp.subExpressions().get(0), cursor);
        };

        if (result) {
            cursor.drop(mark);
        } else {
            cursor.restore(mark);
        }
        return result;
    }

    private boolean matchOr(Expression exp, MatchCursor<T> cursor) {
        for (Expression alternative : exp.subExpressions()) {
            if (match(alternative, cursor)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchOrOr(Expression exp, MatchCursor<T> cursor) {
        return matchMany(exp, cursor) > 0;
    }

    private boolean matchAndAnd(Expression exp, MatchCursor<T> cursor) {
        int variablesBefore = cursor.variableCount();
        int matchCount = matchMany(exp, cursor);
        if (matchCount == exp.subExpressions().size()) {
            return true;
        }
        // a variable may stand for the alternatives that found no token of their own
        return cursor.variableCount() > variablesBefore;
    }

    private boolean matchJuxtaposition(Expression exp, MatchCursor<T> cursor) {
        for (Expression sub : exp.subExpressions()) {
            if (!match(sub, cursor)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Match as many sub-expressions as possible, in any order, each at most once.
     * The scan restarts from the first unmatched sub-expression after every success,
     * so the order of the value, not of the syntax, decides what gets consumed first.
     *
     * @return Number of sub-expressions matched
     */
    private int matchMany(Expression exp, MatchCursor<T> cursor) {
        List<Expression> subExpressions = exp.subExpressions();
        boolean[] matched = new boolean[subExpressions.size()];
        int matchCount = 0;

        int i = 0;
        while (i < subExpressions.size()) {
            if (!matched[i] && match(subExpressions.get(i), cursor)) {
                matched[i] = true;
                matchCount++;
                i = 0;
            } else {
                i++;
            }
        }
        return matchCount;
    }

    /**
     * Position in the token sequence with a stack of saved positions.
     * A mark saves both the token index and the variable count; restoring a mark
     * rewinds both.
     */
    static final class MatchCursor<T> {

        private final List<T> tokens;
        private int index;
        private int variableCount;
        private int[] marks = new int[16];
        private int markDepth;

        MatchCursor(List<T> tokens) {
            this.tokens = tokens;
        }

        boolean hasCurrent() {
            return index < tokens.size();
        }

        T current() {
            return hasCurrent() ? tokens.get(index) : null;
        }

        void moveNext() {
            if (hasCurrent()) {
                index++;
            }
        }

        int index() {
            return index;
        }

        int variableCount() {
            return variableCount;
        }

        void countVariable() {
            variableCount++;
        }

        int markDepth() {
            return markDepth;
        }

        /**
         * Save the current position.
         *
         * @return Depth of the new mark, to be passed to {@link #drop} or {@link #restore}
         */
        int mark() {
            if ((markDepth + 1) * 2 > marks.length) {
                marks = Arrays.copyOf(marks, marks.length * 2);
            }
            marks[markDepth * 2] = index;
            marks[markDepth * 2 + 1] = variableCount;
            return ++markDepth;
        }

        /**
         * Discard a mark, keeping the current position.
         */
        void drop(int mark) {
            checkTop(mark);
            markDepth--;
        }

        /**
         * Rewind to a mark and discard it.
         */
        void restore(int mark) {
            checkTop(mark);
            markDepth--;
            index = marks[markDepth * 2];
            variableCount = marks[markDepth * 2 + 1];
        }

        private void checkTop(int mark) {
            if (mark != markDepth) {
                throw new IllegalStateException("Mark " + mark + " released out of order, top is " + markDepth);
            }
        }
    }
}

package com.cascade.dsl;

import com.cascade.exception.RuleSyntaxException;
import com.cascade.model.Condition;
import com.cascade.model.Operand;
import com.cascade.model.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.cascade.dsl.DslConfig.Symbols.*;

/**
 * Parses the text of a when-clause (or of a child(...) filter) into conditions.
 * <pre>
 * conditions := condition (' and ' condition)*
 * condition  := operand operator operand
 * </pre>
 * The operator is the first operator token found outside quotes and
 * parentheses, trying tokens in {@link Operator} declaration order at each
 * position so that "not matches" wins over "matches" and "is not" over "is".
 */
public final class ConditionParser {

    private static final Logger log = LoggerFactory.getLogger(ConditionParser.class);

    private final ParserMode mode;
    private final OperandParser operandParser;

    public ConditionParser(ParserMode mode) {
        this.mode = mode;
        this.operandParser = new OperandParser(this);
    }

    public OperandParser operandParser() {
        return operandParser;
    }

    /**
     * Parse an AND-joined list of conditions.
     *
     * @param text   Condition text
     * @param origin Line the text came from
     * @return Parsed conditions in textual order
     */
    public List<Condition> parseConditions(String text, SourceLine origin) {
        List<Condition> conditions = new ArrayList<>();
        for (String chunk : QuotedText.split(text, CONDITION_SEPARATOR)) {
            try {
                conditions.add(parseCondition(chunk, origin));
            } catch (RuleSyntaxException e) {
                if (mode == ParserMode.STRICT) {
                    throw e;
                }
                log.warn("Dropping condition '{}' at line {}: {}", chunk, origin.number(), e.getMessage());
            }
        }
        if (conditions.isEmpty() && mode == ParserMode.STRICT) {
            throw new RuleSyntaxException("Expected at least one condition", origin.number(), origin.text());
        }
        return conditions;
    }

    /**
     * Parse a single condition.
     */
    public Condition parseCondition(String chunk, SourceLine origin) {
        String text = chunk.trim();
        OperatorMatch match = findOperator(text);
        if (match == null) {
            throw new RuleSyntaxException("No operator found in condition '" + text + "'",
                    origin.number(), origin.text());
        }

        Operator operator = match.operator();
        String leftText = text.substring(0, match.index()).trim();
        String rightText = text.substring(match.index() + operator.token().length()).trim();

        Operand left = operandParser.parse(leftText, origin);
        Operand right = operandParser.parse(rightText, origin);
        return new Condition(left, operator, right);
    }

    /**
     * Locate the operator, or null when there is none.
     */
    private OperatorMatch findOperator(String text) {
        boolean inQuotes = false;
        int depth = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
                continue;
            }
            if (inQuotes) {
                continue;
            }
            if (c == LEFT_PAREN) {
                depth++;
                continue;
            }
            if (c == RIGHT_PAREN) {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth > 0 || (i > 0 && !Character.isWhitespace(text.charAt(i - 1)))) {
                continue;
            }
            for (Operator operator : Operator.values()) {
                if (text.startsWith(operator.token(), i) && endsWord(text, i + operator.token().length())) {
                    return new OperatorMatch(i, operator);
                }
            }
        }
        return null;
    }

    private record OperatorMatch(int index, Operator operator) {
    }

    private static boolean endsWord(String text, int end) {
        return end == text.length()
                || Character.isWhitespace(text.charAt(end))
                || text.charAt(end) == QUOTE;
    }
}

package com.cascade.dsl;

import com.cascade.exception.RuleSyntaxException;
import com.cascade.model.Condition;
import com.cascade.model.ConstOperand;
import com.cascade.model.ObjectOperand;
import com.cascade.model.Operand;
import com.cascade.model.Scope;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.cascade.dsl.DslConfig.Symbols.DOT;
import static com.cascade.dsl.DslConfig.Symbols.LEFT_PAREN;

/**
 * Parses operand text.
 * <pre>
 * operand := '"' literal '"'
 *          | ('child' | 'children') '(' conditions ')' '.' field
 *          | ('me' | 'parent' | 'child' | 'children') '.' field
 *          | field
 * </pre>
 */
public final class OperandParser {

    private static final String FIELD = "[A-Za-z_$][\\w.$-]*";
    private static final Pattern FIELD_PATTERN = Pattern.compile(FIELD);
    private static final Pattern SCOPED_PATTERN =
            Pattern.compile("^(me|parent|child|children)\\.(" + FIELD + ")$");

    private final ConditionParser conditionParser;

    OperandParser(ConditionParser conditionParser) {
        this.conditionParser = conditionParser;
    }

    /**
     * Parse a value operand.
     *
     * @param text   Operand text
     * @param origin Line the text came from, for error reporting
     * @return Literal or field reference
     */
    public Operand parse(String text, SourceLine origin) {
        String operand = text.trim();
        if (operand.isEmpty()) {
            throw new RuleSyntaxException("Missing operand", origin.number(), origin.text());
        }

        if (QuotedText.isQuoted(operand)) {
            return new ConstOperand(QuotedText.unquote(operand));
        }

        Optional<ObjectOperand> filtered = parseFilteredSelector(operand, origin);
        if (filtered.isPresent()) {
            return filtered.get();
        }

        Matcher scoped = SCOPED_PATTERN.matcher(operand);
        if (scoped.matches()) {
            Scope scope = Scope.fromKeyword(scoped.group(1)).orElseThrow();
            return new ObjectOperand(scope, scoped.group(2));
        }

        if (FIELD_PATTERN.matcher(operand).matches()) {
            return new ObjectOperand(Scope.IMPLICIT, operand);
        }

        throw new RuleSyntaxException("Invalid operand '" + operand + "'", origin.number(), origin.text());
    }

    /**
     * Parse an assignable field reference (left side of an action).
     */
    public ObjectOperand parseTarget(String text, SourceLine origin) {
        Operand operand = parse(text, origin);
        if (operand instanceof ObjectOperand target) {
            return target;
        }
        throw new RuleSyntaxException("Action target must be a field reference, got " + operand,
                origin.number(), origin.text());
    }

    private Optional<ObjectOperand> parseFilteredSelector(String operand, SourceLine origin) {
        Scope scope;
        if (operand.startsWith(Scope.CHILDREN.keyword() + LEFT_PAREN)) {
            scope = Scope.CHILDREN;
        } else if (operand.startsWith(Scope.CHILD.keyword() + LEFT_PAREN)) {
            scope = Scope.CHILD;
        } else {
            return Optional.empty();
        }

        int open = scope.keyword().length();
        int close = QuotedText.findClosingParen(operand, open);
        if (close < 0) {
            throw new RuleSyntaxException("Unclosed '(' in '" + operand + "'", origin.number(), origin.text());
        }

        String rest = operand.substring(close + 1);
        if (rest.isEmpty() || rest.charAt(0) != DOT || !FIELD_PATTERN.matcher(rest.substring(1)).matches()) {
            throw new RuleSyntaxException("Expected '.field' after " + scope.keyword() + "(...)",
                    origin.number(), origin.text());
        }

        List<Condition> conditions = conditionParser.parseConditions(
                operand.substring(open + 1, close), origin);
        return Optional.of(new ObjectOperand(scope, rest.substring(1), conditions));
    }
}

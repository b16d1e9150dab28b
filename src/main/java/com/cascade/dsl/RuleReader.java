package com.cascade.dsl;

import com.cascade.exception.RuleSyntaxException;
import com.cascade.model.Action;
import com.cascade.model.Condition;
import com.cascade.model.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.cascade.dsl.DslConfig.Keywords.*;

/**
 * Walks the significant lines of a rule book, one pass, one rule at a time.
 * <pre>
 * rulebook := rule*
 * rule     := 'rule' '"' name '"' ':' NEWLINE
 *             'when' conditions (NEWLINE conditions)*
 *             'then' actions (NEWLINE actions)*
 * </pre>
 * Not thread-safe; create one per parse.
 */
final class RuleReader {

    private static final Logger log = LoggerFactory.getLogger(RuleReader.class);

    private static final Pattern HEADER_PATTERN = Pattern.compile("^rule\\s+\"([^\"]+)\":\\s*$");
    private static final Pattern INLINE_HEADER_PATTERN = Pattern.compile("^(rule\\s+\"[^\"]+\":)\\s*(\\S.*)$");

    private final List<SourceLine> lines;
    private final ParserMode mode;
    private final ConditionParser conditionParser;
    private final ActionParser actionParser;
    private int index;

    RuleReader(List<SourceLine> lines, ParserMode mode,
               ConditionParser conditionParser, ActionParser actionParser) {
        this.lines = splitInlineClauses(lines);
        this.mode = mode;
        this.conditionParser = conditionParser;
        this.actionParser = actionParser;
        this.index = 0;
    }

    List<Rule> readAll() {
        List<Rule> rules = new ArrayList<>();
        while (!isAtEnd()) {
            SourceLine line = peek();
            if (line.startsWithKeyword(RULE)) {
                rules.add(readRule());
                continue;
            }
            if (mode == ParserMode.STRICT) {
                throw new RuleSyntaxException("Expected 'rule \"<name>\":'", line.number(), line.text());
            }
            log.warn("Ignoring line {} outside of a rule: {}", line.number(), line.text());
            index++;
        }
        return rules;
    }

    private Rule readRule() {
        SourceLine header = advance();
        Matcher matcher = HEADER_PATTERN.matcher(header.text());
        if (!matcher.matches()) {
            throw new RuleSyntaxException("Malformed rule header, expected 'rule \"<name>\":'",
                    header.number(), header.text());
        }
        String name = matcher.group(1);

        SourceLine whenLine = expectClause(WHEN, header);
        StringBuilder conditionText = new StringBuilder(whenLine.afterKeyword(WHEN));
        while (!isAtEnd() && !peek().startsWithKeyword(THEN) && !peek().startsWithKeyword(RULE)) {
            conditionText.append(' ').append(advance().text());
        }

        SourceLine thenLine = expectClause(THEN, isAtEnd() ? whenLine : peek());
        StringBuilder actionText = new StringBuilder(thenLine.afterKeyword(THEN));
        while (!isAtEnd() && !peek().startsWithKeyword(RULE)) {
            actionText.append(' ').append(advance().text());
        }

        List<Condition> conditions = conditionParser.parseConditions(conditionText.toString().trim(), whenLine);
        List<Action> actions = actionParser.parseActions(actionText.toString().trim(), thenLine);
        if (actions.isEmpty()) {
            throw new RuleSyntaxException("Rule '" + name + "' has no actions", thenLine.number(), thenLine.text());
        }

        log.debug("Parsed rule '{}' with {} conditions and {} actions", name, conditions.size(), actions.size());
        return new Rule(name, conditions, actions);
    }

    /**
     * Put clauses written on one line ({@code rule "x": when ... then ...})
     * on lines of their own, keeping the original line number.
     */
    static List<SourceLine> splitInlineClauses(List<SourceLine> lines) {
        List<SourceLine> result = new ArrayList<>(lines.size());
        for (SourceLine line : lines) {
            String text = line.text();
            Matcher header = INLINE_HEADER_PATTERN.matcher(text);
            if (header.matches()) {
                result.add(new SourceLine(line.number(), header.group(1)));
                text = header.group(2);
            }
            int then = line.startsWithKeyword(THEN) ? -1 : QuotedText.indexOfWord(text, THEN);
            if (then > 0) {
                result.add(new SourceLine(line.number(), text.substring(0, then).trim()));
                text = text.substring(then).trim();
            }
            result.add(new SourceLine(line.number(), text));
        }
        return result;
    }

    private SourceLine expectClause(String keyword, SourceLine context) {
        if (isAtEnd() || !peek().startsWithKeyword(keyword)) {
            SourceLine at = isAtEnd() ? context : peek();
            throw new RuleSyntaxException("Expected '" + keyword + "' clause", at.number(), at.text());
        }
        return advance();
    }

    private SourceLine peek() {
        return lines.get(index);
    }

    private SourceLine advance() {
        return lines.get(index++);
    }

    private boolean isAtEnd() {
        return index >= lines.size();
    }
}

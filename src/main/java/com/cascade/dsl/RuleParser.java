package com.cascade.dsl;

import com.cascade.model.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Facade for parsing rule text into rules.
 * <p>
 * Example:
 * <pre>
 * # Lines starting with '#' are comments
 * rule "Developer Task Started":
 *     when me.Title contains "Dev" and me.State is "Active"
 *     then set parent.AssignedTo = me.AssignedTo
 *          set with notifications parent.State = "Active"
 * </pre>
 * Stateless and safe to share between threads; the same text always yields
 * equal rule lists.
 */
public final class RuleParser {

    private static final Logger log = LoggerFactory.getLogger(RuleParser.class);

    private final ParserMode mode;
    private final ConditionParser conditionParser;
    private final ActionParser actionParser;

    public RuleParser() {
        this(ParserMode.STRICT);
    }

    public RuleParser(ParserMode mode) {
        this.mode = mode;
        this.conditionParser = new ConditionParser(mode);
        this.actionParser = new ActionParser(mode, conditionParser.operandParser());
    }

    /**
     * Parse rule text.
     *
     * @param text Rule book text
     * @return Rules in declaration order
     * @throws com.cascade.exception.RuleSyntaxException on malformed text
     */
    public List<Rule> parse(String text) {
        List<SourceLine> lines = SourceLine.read(text);
        List<Rule> rules = new RuleReader(lines, mode, conditionParser, actionParser).readAll();
        log.debug("Parsed {} rules ({} mode)", rules.size(), mode);
        return List.copyOf(rules);
    }

    public ParserMode getMode() {
        return mode;
    }
}

package com.cascade.dsl;

import com.cascade.exception.RuleSyntaxException;
import com.cascade.model.Action;
import com.cascade.model.ActionType;
import com.cascade.model.AlterOptions;
import com.cascade.model.ConstOperand;
import com.cascade.model.ObjectOperand;
import com.cascade.model.Operand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.cascade.dsl.DslConfig.Keywords.*;
import static com.cascade.dsl.DslConfig.Options.*;
import static com.cascade.dsl.DslConfig.Symbols.*;

/**
 * Parses the text of a then-clause into actions.
 * <pre>
 * actions := action+
 * action  := 'set' [options] target '=' operand
 *          | 'add' [options] '"' literal '"' 'to' target
 *          | 'remove' [options] '"' literal '"' 'from' target
 * options := 'with' option ((',' | ' ') option)*
 * option  := 'notifications' | 'suppressNotifications' | 'bypassRules'
 * </pre>
 * Actions are not delimited; a new one starts at each action keyword found
 * as a whole word outside quotes and parentheses.
 */
public final class ActionParser {

    private static final Logger log = LoggerFactory.getLogger(ActionParser.class);

    private static final Pattern ADD_PATTERN = Pattern.compile("^\"([^\"]+)\"\\s+" + TO + "\\s+(.+)$");
    private static final Pattern REMOVE_PATTERN = Pattern.compile("^\"([^\"]+)\"\\s+" + FROM + "\\s+(.+)$");

    private final ParserMode mode;
    private final OperandParser operandParser;

    public ActionParser(ParserMode mode, OperandParser operandParser) {
        this.mode = mode;
        this.operandParser = operandParser;
    }

    /**
     * Parse all actions of a then-clause.
     *
     * @param text   Action text (without the 'then' keyword)
     * @param origin Line the clause starts on
     * @return Actions in textual order
     */
    public List<Action> parseActions(String text, SourceLine origin) {
        List<Action> actions = new ArrayList<>();
        for (String chunk : splitActions(text)) {
            try {
                actions.add(parseAction(chunk, origin));
            } catch (RuleSyntaxException e) {
                if (mode == ParserMode.STRICT) {
                    throw e;
                }
                log.warn("Dropping action '{}' at line {}: {}", chunk, origin.number(), e.getMessage());
            }
        }
        return actions;
    }

    /**
     * Parse a single action chunk.
     */
    public Action parseAction(String chunk, SourceLine origin) {
        String text = chunk.trim();
        ActionType type = null;
        for (ActionType candidate : ActionType.values()) {
            if (isKeywordAt(text, 0, candidate.keyword())) {
                type = candidate;
                break;
            }
        }
        if (type == null) {
            throw new RuleSyntaxException("Unrecognized action '" + text + "'", origin.number(), origin.text());
        }

        String rest = text.substring(type.keyword().length()).trim();
        AlterOptions options = AlterOptions.defaults();
        if (isKeywordAt(rest, 0, WITH)) {
            rest = rest.substring(WITH.length()).trim();
            int consumed = 0;
            Boolean suppressNotifications = null;
            Boolean bypassRules = null;
            String word = optionWord(rest);
            while (ALL.contains(word)) {
                switch (word) {
                    case NOTIFICATIONS -> suppressNotifications = Boolean.FALSE;
                    case SUPPRESS_NOTIFICATIONS -> suppressNotifications = Boolean.TRUE;
                    case BYPASS_RULES -> bypassRules = Boolean.TRUE;
                    default -> {
                    }
                }
                rest = skipOptionSeparators(rest.substring(word.length()));
                word = optionWord(rest);
                consumed++;
            }
            if (consumed == 0) {
                throw new RuleSyntaxException("Expected an option after 'with' in '" + text + "'",
                        origin.number(), origin.text());
            }
            options = new AlterOptions(suppressNotifications, bypassRules);
        }

        return switch (type) {
            case SET -> parseSet(rest, options, origin);
            case ADD -> parseListUpdate(ActionType.ADD, ADD_PATTERN, rest, options, origin);
            case REMOVE -> parseListUpdate(ActionType.REMOVE, REMOVE_PATTERN, rest, options, origin);
        };
    }

    private Action parseSet(String rest, AlterOptions options, SourceLine origin) {
        int assign = QuotedText.indexOf(rest, ASSIGN);
        if (assign < 0) {
            throw new RuleSyntaxException("Expected '=' in set action '" + rest + "'",
                    origin.number(), origin.text());
        }
        ObjectOperand target = operandParser.parseTarget(rest.substring(0, assign), origin);
        Operand value = operandParser.parse(rest.substring(assign + 1), origin);
        return new Action(ActionType.SET, options, target, value);
    }

    private Action parseListUpdate(ActionType type, Pattern pattern, String rest,
                                   AlterOptions options, SourceLine origin) {
        Matcher matcher = pattern.matcher(rest);
        if (!matcher.matches()) {
            String preposition = type == ActionType.ADD ? TO : FROM;
            throw new RuleSyntaxException("Expected '\"<value>\" " + preposition + " <field>' in "
                    + type.keyword() + " action", origin.number(), origin.text());
        }
        ObjectOperand target = operandParser.parseTarget(matcher.group(2), origin);
        return new Action(type, options, target, new ConstOperand(matcher.group(1)));
    }

    /**
     * Split action text at action keywords preceded by whitespace (or at the
     * start) and followed by whitespace (or the end).
     */
    static List<String> splitActions(String text) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int depth = 0;
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (!inQuotes && depth == 0 && !current.toString().isBlank()
                    && (i == 0 || Character.isWhitespace(text.charAt(i - 1)))) {
                String keyword = keywordAt(text, i);
                if (keyword != null) {
                    chunks.add(current.toString().trim());
                    current.setLength(0);
                    current.append(keyword);
                    i += keyword.length();
                    continue;
                }
            }
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == LEFT_PAREN) {
                depth++;
            } else if (!inQuotes && c == RIGHT_PAREN && depth > 0) {
                depth--;
            }
            current.append(c);
            i++;
        }

        if (!current.toString().isBlank()) {
            chunks.add(current.toString().trim());
        }
        return chunks;
    }

    /**
     * Leading option word; options are separated by whitespace and/or commas.
     */
    private static String optionWord(String text) {
        int end = 0;
        while (end < text.length() && !isOptionSeparator(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    private static String skipOptionSeparators(String text) {
        int start = 0;
        while (start < text.length() && isOptionSeparator(text.charAt(start))) {
            start++;
        }
        return text.substring(start);
    }

    private static boolean isOptionSeparator(char c) {
        return Character.isWhitespace(c) || c == OPTION_SEPARATOR;
    }

    private static String keywordAt(String text, int index) {
        for (ActionType type : ActionType.values()) {
            if (isKeywordAt(text, index, type.keyword())) {
                return type.keyword();
            }
        }
        return null;
    }

    private static boolean isKeywordAt(String text, int index, String keyword) {
        if (!text.startsWith(keyword, index)) {
            return false;
        }
        int end = index + keyword.length();
        return end == text.length() || Character.isWhitespace(text.charAt(end));
    }
}

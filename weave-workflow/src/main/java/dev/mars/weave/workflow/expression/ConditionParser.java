/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.weave.workflow.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser and evaluator for decision conditions.
 *
 * <pre>
 * expr       := orExpr
 * orExpr     := andExpr ( ("||" | "or") andExpr )*
 * andExpr    := notExpr ( ("&amp;&amp;" | "and") notExpr )*
 * notExpr    := "!" notExpr | comparison
 * comparison := operand ( ("==" | "===" | "!=" | "!==" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") operand )?
 * operand    := NUMBER | STRING | "true" | "false" | "null" | WORD | "(" expr ")"
 * </pre>
 *
 * Numbers compare numerically when both sides are numbers; otherwise values compare as strings.
 * {@code ===} and {@code !==} additionally require both sides to be of the same kind.
 * Bare words are plain strings, which is what a substituted variable usually becomes.
 */
public class ConditionParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final String WORD_TERMINATORS = "()'\"&|=!<>";

    /** Deepest nesting of parentheses and negations accepted in one expression. */
    static final int MAX_NESTING_DEPTH = 64;

    /**
     * Parses and evaluates an expression.
     *
     * @return the value of the expression: a Boolean, BigDecimal, String or null
     * @throws ConditionParseException if the expression does not match the grammar
     */
    public Object parse(String expression) throws ConditionParseException {
        if (expression == null) {
            throw new ConditionParseException("null", 0, "Expression is null");
        }
        Cursor cursor = new Cursor(expression, tokenize(expression));
        Object value = orExpr(cursor);
        Token trailing = cursor.peek();
        if (trailing.kind != Kind.EOF) {
            throw cursor.error("Unexpected '" + trailing.text + "'", trailing);
        }
        return value;
    }

    /**
     * Truthiness of a bare value: booleans as is, numbers when non-zero,
     * strings when non-empty and not "false", null never.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() != 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        String text = value.toString();
        return !text.isEmpty() && !text.equalsIgnoreCase("false");
    }

    private Object orExpr(Cursor cursor) throws ConditionParseException {
        Object left = andExpr(cursor);
        while (cursor.peek().kind == Kind.OR) {
            cursor.next();
            Object right = andExpr(cursor);
            left = isTruthy(left) || isTruthy(right);
        }
        return left;
    }

    private Object andExpr(Cursor cursor) throws ConditionParseException {
        Object left = notExpr(cursor);
        while (cursor.peek().kind == Kind.AND) {
            cursor.next();
            Object right = notExpr(cursor);
            left = isTruthy(left) && isTruthy(right);
        }
        return left;
    }

    private Object notExpr(Cursor cursor) throws ConditionParseException {
        if (cursor.peek().kind == Kind.NOT) {
            cursor.enter(cursor.next());
            boolean negated = !isTruthy(notExpr(cursor));
            cursor.exit();
            return negated;
        }
        return comparison(cursor);
    }

    private Object comparison(Cursor cursor) throws ConditionParseException {
        Object left = operand(cursor);
        if (cursor.peek().kind != Kind.COMPARATOR) {
            return left;
        }
        String operator = cursor.next().text;
        Object right = operand(cursor);
        return compare(operator, left, right);
    }

    private Object operand(Cursor cursor) throws ConditionParseException {
        Token token = cursor.next();
        switch (token.kind) {
            case NUMBER:
                return new BigDecimal(token.text);
            case STRING:
            case WORD:
                return token.text;
            case TRUE:
                return Boolean.TRUE;
            case FALSE:
                return Boolean.FALSE;
            case NULL:
                return null;
            case LPAREN:
                cursor.enter(token);
                Object inner = orExpr(cursor);
                Token closing = cursor.next();
                if (closing.kind != Kind.RPAREN) {
                    throw cursor.error("Expected ')'", closing);
                }
                cursor.exit();
                return inner;
            case EOF:
                throw cursor.error("Unexpected end of expression", token);
            default:
                throw cursor.error("Unexpected '" + token.text + "'", token);
        }
    }

    static boolean compare(String operator, Object left, Object right) {
        switch (operator) {
            case "==":
                return looselyEqual(left, right);
            case "!=":
                return !looselyEqual(left, right);
            case "===":
                return sameKind(left, right) && looselyEqual(left, right);
            case "!==":
                return !(sameKind(left, right) && looselyEqual(left, right));
            default:
                return order(operator, left, right);
        }
    }

    private static boolean looselyEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (left instanceof BigDecimal && right instanceof BigDecimal) {
            return ((BigDecimal) left).compareTo((BigDecimal) right) == 0;
        }
        return asText(left).equals(asText(right));
    }

    private static boolean order(String operator, Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        int comparison;
        if (left instanceof BigDecimal && right instanceof BigDecimal) {
            comparison = ((BigDecimal) left).compareTo((BigDecimal) right);
        } else {
            comparison = asText(left).compareTo(asText(right));
        }
        switch (operator) {
            case "<":
                return comparison < 0;
            case "<=":
                return comparison <= 0;
            case ">":
                return comparison > 0;
            case ">=":
                return comparison >= 0;
            default:
                throw new IllegalArgumentException("Unsupported comparison operator: " + operator);
        }
    }

    private static boolean sameKind(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        return left.getClass() == right.getClass();
    }

    private static String asText(Object value) {
        if (value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            return number.signum() == 0 ? "0" : number.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    List<Token> tokenize(String expression) throws ConditionParseException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = expression.length();

        while (i < length) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            int start = i;
            if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", start));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", start));
                i++;
            } else if (c == '\'' || c == '"') {
                StringBuilder text = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < length) {
                    char ch = expression.charAt(i);
                    if (ch == '\\' && i + 1 < length) {
                        text.append(expression.charAt(i + 1));
                        i += 2;
                    } else if (ch == c) {
                        closed = true;
                        i++;
                        break;
                    } else {
                        text.append(ch);
                        i++;
                    }
                }
                if (!closed) {
                    throw new ConditionParseException(expression, start, "Unterminated string literal");
                }
                tokens.add(new Token(Kind.STRING, text.toString(), start));
            } else if (expression.startsWith("&&", i)) {
                tokens.add(new Token(Kind.AND, "&&", start));
                i += 2;
            } else if (expression.startsWith("||", i)) {
                tokens.add(new Token(Kind.OR, "||", start));
                i += 2;
            } else if (expression.startsWith("===", i) || expression.startsWith("!==", i)) {
                tokens.add(new Token(Kind.COMPARATOR, expression.substring(i, i + 3), start));
                i += 3;
            } else if (expression.startsWith("==", i) || expression.startsWith("!=", i)
                    || expression.startsWith("<=", i) || expression.startsWith(">=", i)) {
                tokens.add(new Token(Kind.COMPARATOR, expression.substring(i, i + 2), start));
                i += 2;
            } else if (c == '<' || c == '>') {
                tokens.add(new Token(Kind.COMPARATOR, String.valueOf(c), start));
                i++;
            } else if (c == '!') {
                tokens.add(new Token(Kind.NOT, "!", start));
                i++;
            } else if (WORD_TERMINATORS.indexOf(c) >= 0) {
                throw new ConditionParseException(expression, start, "Unexpected character '" + c + "'");
            } else {
                while (i < length && !Character.isWhitespace(expression.charAt(i))
                        && WORD_TERMINATORS.indexOf(expression.charAt(i)) < 0) {
                    i++;
                }
                tokens.add(classify(expression.substring(start, i), start));
            }
        }

        tokens.add(new Token(Kind.EOF, "", length));
        return tokens;
    }

    private static Token classify(String word, int position) {
        if (NUMBER.matcher(word).matches()) {
            return new Token(Kind.NUMBER, word, position);
        }
        switch (word.toLowerCase(Locale.ROOT)) {
            case "true":
                return new Token(Kind.TRUE, word, position);
            case "false":
                return new Token(Kind.FALSE, word, position);
            case "null":
                return new Token(Kind.NULL, word, position);
            case "and":
                return new Token(Kind.AND, word, position);
            case "or":
                return new Token(Kind.OR, word, position);
            default:
                return new Token(Kind.WORD, word, position);
        }
    }

    enum Kind {
        NUMBER, STRING, WORD, TRUE, FALSE, NULL, AND, OR, NOT, COMPARATOR, LPAREN, RPAREN, EOF
    }

    static final class Token {
        final Kind kind;
        final String text;
        final int position;

        Token(Kind kind, String text, int position) {
            this.kind = kind;
            this.text = text;
            this.position = position;
        }

        @Override
        public String toString() {
            return kind + "(" + text + ")";
        }
    }

    private static final class Cursor {
        private final String expression;
        private final List<Token> tokens;
        private int index;
        private int depth;

        Cursor(String expression, List<Token> tokens) {
            this.expression = expression;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (token.kind != Kind.EOF) {
                index++;
            }
            return token;
        }

        void enter(Token token) throws ConditionParseException {
            if (++depth > MAX_NESTING_DEPTH) {
                throw error("Expression nested deeper than " + MAX_NESTING_DEPTH + " levels", token);
            }
        }

        void exit() {
            depth--;
        }

        ConditionParseException error(String message, Token token) {
            return new ConditionParseException(expression, token.position, message);
        }
    }
}

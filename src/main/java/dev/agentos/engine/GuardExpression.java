package dev.agentos.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * A boolean condition over context values, e.g. {@code security.score > 80 && !skip_docs}.
 *
 * <p>Supports {@code || && !}, parentheses, {@code == != < <= > >=}, number and string
 * literals, {@code true false null} and dotted identifiers. A comparison that involves an
 * absent value is false; {@code !absent} is true.
 */
public final class GuardExpression {

    private static final Object ABSENT = new Object();

    private final String source;
    private final Node root;
    private final Set<String> identifiers;

    private GuardExpression(String source, Node root, Set<String> identifiers) {
        this.source = source;
        this.root = root;
        this.identifiers = identifiers;
    }

    /**
     * @throws IllegalArgumentException if {@code source} is not a valid expression
     */
    public static GuardExpression parse(String source) {
        var parser = new Parser(tokenize(source));
        Node root = parser.parseOr();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Unexpected '%s' in guard '%s'".formatted(parser.peek().text, source));
        }
        return new GuardExpression(source, root, Set.copyOf(parser.identifiers));
    }

    public String source() {
        return source;
    }

    /** Identifiers referenced by the expression, as written. */
    public Set<String> identifiers() {
        return identifiers;
    }

    public boolean evaluate(Function<String, Optional<Object>> resolver) {
        return truthy(root.eval(resolver));
    }

    // --- evaluation ---

    private sealed interface Node permits Literal, Ref, Not, And, Or, Compare {
        Object eval(Function<String, Optional<Object>> resolver);
    }

    private record Literal(Object value) implements Node {
        public Object eval(Function<String, Optional<Object>> resolver) {
            return value;
        }
    }

    private record Ref(String name) implements Node {
        public Object eval(Function<String, Optional<Object>> resolver) {
            Optional<Object> value = resolver.apply(name);
            return value.isPresent() ? value.get() : ABSENT;
        }
    }

    private record Not(Node operand) implements Node {
        public Object eval(Function<String, Optional<Object>> resolver) {
            return !truthy(operand.eval(resolver));
        }
    }

    private record And(Node left, Node right) implements Node {
        public Object eval(Function<String, Optional<Object>> resolver) {
            return truthy(left.eval(resolver)) && truthy(right.eval(resolver));
        }
    }

    private record Or(Node left, Node right) implements Node {
        public Object eval(Function<String, Optional<Object>> resolver) {
            return truthy(left.eval(resolver)) || truthy(right.eval(resolver));
        }
    }

    private record Compare(Node left, String op, Node right) implements Node {
        public Object eval(Function<String, Optional<Object>> resolver) {
            Object l = left.eval(resolver);
            Object r = right.eval(resolver);
            if (l == ABSENT || r == ABSENT) {
                return false;
            }
            return switch (op) {
                case "==" -> equal(l, r);
                case "!=" -> !equal(l, r);
                default -> ordered(l, op, r);
            };
        }
    }

    static boolean truthy(Object value) {
        if (value == ABSENT || value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s);
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    private static boolean equal(Object l, Object r) {
        if (l == null || r == null) {
            return l == r;
        }
        Double ln = number(l);
        Double rn = number(r);
        if (ln != null && rn != null) {
            return ln.doubleValue() == rn.doubleValue();
        }
        return String.valueOf(l).equals(String.valueOf(r));
    }

    private static boolean ordered(Object l, String op, Object r) {
        int cmp;
        Double ln = number(l);
        Double rn = number(r);
        if (ln != null && rn != null) {
            cmp = Double.compare(ln, rn);
        } else if (l instanceof String ls && r instanceof String rs) {
            cmp = ls.compareTo(rs);
        } else {
            return false;
        }
        return switch (op) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            case ">=" -> cmp >= 0;
            default -> throw new IllegalStateException("Unknown operator " + op);
        };
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // --- parsing ---

    private enum TokenType { NUMBER, STRING, IDENT, OP, LPAREN, RPAREN }

    private record Token(TokenType type, String text) {}

    private static List<Token> tokenize(String source) {
        var tokens = new ArrayList<Token>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = source.indexOf(c, i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated string in guard '%s'".formatted(source));
                }
                tokens.add(new Token(TokenType.STRING, source.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < source.length()
                && Character.isDigit(source.charAt(i + 1)))) {
                int start = i++;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i++;
                while (i < source.length() && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENT, source.substring(start, i)));
            } else {
                String two = i + 1 < source.length() ? source.substring(i, i + 2) : "";
                if (Set.of("==", "!=", "<=", ">=", "&&", "||").contains(two)) {
                    tokens.add(new Token(TokenType.OP, two));
                    i += 2;
                } else if (c == '<' || c == '>' || c == '!') {
                    tokens.add(new Token(TokenType.OP, String.valueOf(c)));
                    i++;
                } else {
                    throw new IllegalArgumentException("Unexpected character '%s' in guard '%s'".formatted(c, source));
                }
            }
        }
        return tokens;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    private static final class Parser {
        private final List<Token> tokens;
        private final Set<String> identifiers = new LinkedHashSet<>();
        private int pos;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        private boolean match(TokenType type, String text) {
            if (!atEnd() && peek().type == type && peek().text.equals(text)) {
                pos++;
                return true;
            }
            return false;
        }

        Node parseOr() {
            Node left = parseAnd();
            while (match(TokenType.OP, "||")) {
                left = new Or(left, parseAnd());
            }
            return left;
        }

        private Node parseAnd() {
            Node left = parseUnary();
            while (match(TokenType.OP, "&&")) {
                left = new And(left, parseUnary());
            }
            return left;
        }

        private Node parseUnary() {
            if (match(TokenType.OP, "!")) {
                return new Not(parseUnary());
            }
            return parseComparison();
        }

        private Node parseComparison() {
            Node left = parsePrimary();
            if (!atEnd() && peek().type == TokenType.OP
                && Set.of("==", "!=", "<", "<=", ">", ">=").contains(peek().text)) {
                String op = tokens.get(pos++).text;
                return new Compare(left, op, parsePrimary());
            }
            return left;
        }

        private Node parsePrimary() {
            if (atEnd()) {
                throw new IllegalArgumentException("Unexpected end of guard expression");
            }
            Token token = tokens.get(pos++);
            switch (token.type) {
                case NUMBER:
                    return new Literal(Double.parseDouble(token.text));
                case STRING:
                    return new Literal(token.text);
                case IDENT:
                    return switch (token.text) {
                        case "true" -> new Literal(Boolean.TRUE);
                        case "false" -> new Literal(Boolean.FALSE);
                        case "null" -> new Literal(null);
                        default -> {
                            identifiers.add(token.text);
                            yield new Ref(token.text);
                        }
                    };
                case LPAREN:
                    Node inner = parseOr();
                    if (!match(TokenType.RPAREN, ")")) {
                        throw new IllegalArgumentException("Missing ')' in guard expression");
                    }
                    return inner;
                default:
                    throw new IllegalArgumentException("Unexpected '%s' in guard expression".formatted(token.text));
            }
        }
    }

    @Override
    public String toString() {
        return source;
    }
}

package com.raditha.typebench.normalization;

import com.raditha.typebench.model.TypeNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses annotation text into a {@link TypeNode} tree.
 * <p>
 * Accepts subscripted generics ({@code Dict[str, List[int]]}), PEP 604 unions
 * ({@code int | None}), {@code Optional}, {@code Callable[[...], R]},
 * {@code Literal[...]} values, {@code ...} and quoted forward references.
 * Normalization happens while parsing: names are canonicalized,
 * {@code Optional[X]} becomes {@code Union[X, None]} and unions are flattened.
 * <p>
 * Parsing never fails the caller. Text that does not follow the grammar comes
 * back as a single UNPARSED leaf carrying the raw string.
 */
public class TypeExpressionParser {

    private static final Logger logger = LoggerFactory.getLogger(TypeExpressionParser.class);

    private static final int MAX_FORWARD_REFERENCE_NESTING = 4;
    private static final int MAX_EXPRESSION_DEPTH = 100;

    private final TypeNameNormalizer normalizer;

    public TypeExpressionParser() {
        this(new TypeNameNormalizer());
    }

    public TypeExpressionParser(TypeNameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Parse an annotation.
     *
     * @param raw annotation text, possibly null or blank
     * @return the parsed tree, or empty when there is no annotation at all
     */
    public Optional<TypeNode> parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parseOrFallback(raw.strip(), 0));
    }

    private TypeNode parseOrFallback(String text, int nesting) {
        try {
            Cursor cursor = new Cursor(tokenize(text), nesting, 0);
            TypeNode node = cursor.parseUnion();
            cursor.expectEnd();
            return node;
        } catch (MalformedAnnotationException e) {
            logger.debug("Keeping malformed annotation '{}' as raw text: {}", text, e.getMessage());
            return TypeNode.unparsed(text);
        }
    }

    // --- Tokenizer ---

    private enum TokenKind {
        NAME, STRING, NUMBER, LBRACKET, RBRACKET, LPAREN, RPAREN, COMMA, PIPE, ELLIPSIS
    }

    private record Token(TokenKind kind, String text) {
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (text.startsWith("...", i)) {
                tokens.add(new Token(TokenKind.ELLIPSIS, "..."));
                i += 3;
            } else if (c == '[') {
                tokens.add(new Token(TokenKind.LBRACKET, "["));
                i++;
            } else if (c == ']') {
                tokens.add(new Token(TokenKind.RBRACKET, "]"));
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenKind.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenKind.RPAREN, ")"));
                i++;
            } else if (c == ',') {
                tokens.add(new Token(TokenKind.COMMA, ","));
                i++;
            } else if (c == '|') {
                tokens.add(new Token(TokenKind.PIPE, "|"));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = text.indexOf(c, i + 1);
                if (end < 0) {
                    throw new MalformedAnnotationException("unterminated string at " + i);
                }
                tokens.add(new Token(TokenKind.STRING, text.substring(i, end + 1)));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < text.length()
                    && Character.isDigit(text.charAt(i + 1)))) {
                int start = i++;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i))
                        || text.charAt(i) == '.' || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenKind.NUMBER, text.substring(start, i)));
            } else if (Character.isJavaIdentifierStart(c)) {
                int start = i++;
                while (i < text.length() && (Character.isJavaIdentifierPart(text.charAt(i))
                        || isDottedContinuation(text, i))) {
                    i++;
                }
                tokens.add(new Token(TokenKind.NAME, text.substring(start, i)));
            } else {
                throw new MalformedAnnotationException("unexpected character '" + c + "' at " + i);
            }
        }
        return tokens;
    }

    private static boolean isDottedContinuation(String text, int i) {
        return text.charAt(i) == '.' && i + 1 < text.length()
                && Character.isJavaIdentifierStart(text.charAt(i + 1));
    }

    // --- Recursive descent ---

    private class Cursor {
        private final List<Token> tokens;
        private final int nesting;
        private int position;
        private int depth;

        Cursor(List<Token> tokens, int nesting, int depth) {
            this.tokens = tokens;
            this.nesting = nesting;
            this.depth = depth;
        }

        TypeNode parseUnion() {
            if (++depth > MAX_EXPRESSION_DEPTH) {
                throw new MalformedAnnotationException("annotation nested deeper than " + MAX_EXPRESSION_DEPTH);
            }
            List<TypeNode> members = new ArrayList<>();
            members.add(parsePrimary());
            while (peek(TokenKind.PIPE)) {
                position++;
                members.add(parsePrimary());
            }
            depth--;
            return members.size() == 1 ? members.get(0) : TypeNode.union(members);
        }

        private TypeNode parsePrimary() {
            Token token = next();
            return switch (token.kind()) {
                case NAME -> parseNamed(token.text());
                case LBRACKET -> TypeNode.parameters(parseArguments(TokenKind.RBRACKET, false));
                case LPAREN -> {
                    TypeNode inner = parseUnion();
                    expect(TokenKind.RPAREN);
                    yield inner;
                }
                case ELLIPSIS -> TypeNode.ellipsis();
                case STRING -> parseForwardReference(token.text());
                default -> throw new MalformedAnnotationException("unexpected token '" + token.text() + "'");
            };
        }

        private TypeNode parseNamed(String written) {
            String name = normalizer.canonicalize(written);
            if (!peek(TokenKind.LBRACKET)) {
                if ("Optional".equals(name) || "Union".equals(name)) {
                    throw new MalformedAnnotationException(name + " requires arguments");
                }
                return TypeNode.leaf(name);
            }
            position++;
            boolean literal = "Literal".equals(name);
            List<TypeNode> args = parseArguments(TokenKind.RBRACKET, literal);
            if ("Optional".equals(name)) {
                if (args.size() != 1) {
                    throw new MalformedAnnotationException("Optional takes exactly one argument");
                }
                return TypeNode.union(List.of(args.get(0), TypeNode.leaf("None")));
            }
            if ("Union".equals(name)) {
                if (args.isEmpty()) {
                    throw new MalformedAnnotationException("Union requires arguments");
                }
                return TypeNode.union(args);
            }
            return TypeNode.generic(name, args);
        }

        private List<TypeNode> parseArguments(TokenKind closing, boolean literal) {
            List<TypeNode> args = new ArrayList<>();
            if (peek(closing)) {
                position++;
                return args;
            }
            while (true) {
                args.add(literal ? parseLiteralValue() : parseUnion());
                if (peek(TokenKind.COMMA)) {
                    position++;
                    if (peek(closing)) {
                        position++;
                        return args;
                    }
                } else {
                    expect(closing);
                    return args;
                }
            }
        }

        private TypeNode parseLiteralValue() {
            Token token = next();
            return switch (token.kind()) {
                case STRING, NUMBER -> TypeNode.value(token.text());
                case NAME -> "None".equals(token.text())
                        ? TypeNode.leaf("None")
                        : TypeNode.value(token.text());
                default -> throw new MalformedAnnotationException("invalid Literal value '" + token.text() + "'");
            };
        }

        private TypeNode parseForwardReference(String quoted) {
            if (nesting >= MAX_FORWARD_REFERENCE_NESTING) {
                throw new MalformedAnnotationException("forward references nested too deeply");
            }
            String inner = quoted.substring(1, quoted.length() - 1).strip();
            if (inner.isEmpty()) {
                throw new MalformedAnnotationException("empty forward reference");
            }
            Cursor nested = new Cursor(tokenize(inner), nesting + 1, depth);
            TypeNode node = nested.parseUnion();
            nested.expectEnd();
            return node;
        }

        private boolean peek(TokenKind kind) {
            return position < tokens.size() && tokens.get(position).kind() == kind;
        }

        private Token next() {
            if (position >= tokens.size()) {
                throw new MalformedAnnotationException("unexpected end of annotation");
            }
            return tokens.get(position++);
        }

        private void expect(TokenKind kind) {
            Token token = next();
            if (token.kind() != kind) {
                throw new MalformedAnnotationException("expected " + kind + " but found '" + token.text() + "'");
            }
        }

        void expectEnd() {
            if (position != tokens.size()) {
                throw new MalformedAnnotationException("trailing input '" + tokens.get(position).text() + "'");
            }
        }
    }

    /**
     * Internal signal that the annotation text does not follow the grammar.
     * Never escapes {@link #parse(String)}.
     */
    private static class MalformedAnnotationException extends RuntimeException {
        MalformedAnnotationException(String message) {
            super(message);
        }
    }
}

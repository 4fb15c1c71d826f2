package com.raditha.typebench.extraction;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the annotated names of a Python repository.
 * <p>
 * Recorded names:
 * <ul>
 * <li>module and class level annotated assignments: {@code pkg.mod.NAME}, {@code pkg.mod.Class.attr}</li>
 * <li>{@code self.x: T} inside methods, attributed to the class: {@code pkg.mod.Class.x}</li>
 * <li>parameters: {@code pkg.mod.func@arg}, {@code pkg.mod.Class.method@arg}</li>
 * <li>returns: {@code pkg.mod.func::return}</li>
 * </ul>
 * Decorated functions and anything defined inside a function body are skipped.
 * The first declaration of a name wins.
 */
public class PythonAnnotationExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PythonAnnotationExtractor.class);

    private static final Pattern CLASS_HEADER = Pattern.compile("^class\\s+([A-Za-z_]\\w*)\\b");
    private static final Pattern DEF_HEADER = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern NAME_TARGET = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Pattern SELF_TARGET = Pattern.compile("^self\\s*\\.\\s*([A-Za-z_]\\w*)$");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "elif", "else", "for", "while", "try", "except", "finally", "with",
            "return", "lambda", "match", "case", "pass", "import", "from", "global",
            "nonlocal", "assert", "del", "raise", "yield", "await", "not", "and", "or");

    private static final Set<String> SKIPPED_DUNDERS = Set.of(
            "__name__", "__doc__", "__file__", "__package__", "__spec__",
            "__annotations__", "__path__", "__match_args__", "__dataclass_fields__");

    private static final Set<String> TYPE_ALIAS = Set.of("TypeAlias", "typing.TypeAlias", "typing_extensions.TypeAlias");

    private static final Set<String> QUALIFIER_WRAPPERS = Set.of(
            "ClassVar", "typing.ClassVar", "Final", "typing.Final", "typing_extensions.Final");

    private final SourceTreeScanner scanner;
    private final PythonSourceReader reader;

    public PythonAnnotationExtractor() {
        this(new SourceTreeScanner(), new PythonSourceReader());
    }

    public PythonAnnotationExtractor(SourceTreeScanner scanner, PythonSourceReader reader) {
        this.scanner = scanner;
        this.reader = reader;
    }

    /**
     * Extract every annotated name in a repository tree.
     *
     * @param repoRoot repository root
     * @return qualified name to annotation site, in source order
     * @throws IOException if the tree itself cannot be read
     */
    public Map<String, AnnotationSite> extract(Path repoRoot) throws IOException {
        Map<String, AnnotationSite> result = new LinkedHashMap<>();
        for (SourceFile file : scanner.scan(repoRoot)) {
            String source;
            try {
                source = Files.readString(file.path(), StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                logger.warn("Skipping {}: not valid UTF-8", file.relativePath());
                continue;
            }
            extractModule(file.module(), file.relativePath(), source)
                    .forEach(result::putIfAbsent);
        }
        return result;
    }

    /**
     * Extract the annotated names of a single module.
     *
     * @param module       dotted module name used as the qualified-name prefix
     * @param relativePath file path recorded on each site
     * @param source       module source text
     */
    public Map<String, AnnotationSite> extractModule(String module, String relativePath, String source) {
        Map<String, AnnotationSite> names = new LinkedHashMap<>();
        Deque<Scope> scopes = new ArrayDeque<>();
        scopes.push(new Scope(ScopeKind.MODULE, module, -1, true, null));
        boolean decorated = false;

        for (LogicalLine line : reader.read(source)) {
            while (scopes.size() > 1 && line.indent() <= scopes.peek().indent()) {
                scopes.pop();
            }
            Scope scope = scopes.peek();
            String text = line.text();

            if (text.startsWith("@")) {
                decorated = true;
                continue;
            }

            Matcher classMatch = CLASS_HEADER.matcher(text);
            if (classMatch.find()) {
                boolean recordable = scope.recordable() && scope.kind() != ScopeKind.FUNCTION;
                scopes.push(new Scope(ScopeKind.CLASS, scope.qualifiedName() + "." + classMatch.group(1),
                        line.indent(), recordable, null));
                decorated = false;
                continue;
            }

            Matcher defMatch = DEF_HEADER.matcher(text);
            if (defMatch.find()) {
                String qualified = scope.qualifiedName() + "." + defMatch.group(1);
                boolean recordable = scope.recordable() && scope.kind() != ScopeKind.FUNCTION && !decorated;
                if (recordable) {
                    recordSignature(names, qualified, text, defMatch.end(), relativePath, line.lineNumber());
                }
                Scope owner = scope.kind() == ScopeKind.CLASS && scope.recordable() ? scope : null;
                scopes.push(new Scope(ScopeKind.FUNCTION, qualified, line.indent(), false, owner));
                decorated = false;
                continue;
            }
            decorated = false;
            recordAssignment(names, scope, text, relativePath, line.lineNumber());
        }
        return names;
    }

    private void recordSignature(Map<String, AnnotationSite> names, String qualified, String header,
                                 int afterName, String file, int line) {
        int open = afterName;
        if (open < header.length() && header.charAt(open) == '[') {
            int typeParamsEnd = TopLevelSplitter.matchingClose(header, open);
            if (typeParamsEnd < 0) {
                return;
            }
            open = typeParamsEnd + 1;
            while (open < header.length() && Character.isWhitespace(header.charAt(open))) {
                open++;
            }
        }
        if (open >= header.length() || header.charAt(open) != '(') {
            return;
        }
        int close = TopLevelSplitter.matchingClose(header, open);
        if (close < 0) {
            logger.debug("Unbalanced signature at {}:{}", file, line);
            return;
        }

        for (String parameter : TopLevelSplitter.split(header.substring(open + 1, close), ',')) {
            String p = parameter.strip();
            if (p.startsWith("**")) {
                p = p.substring(2);
            } else if (p.startsWith("*")) {
                p = p.substring(1);
            }
            int colon = TopLevelSplitter.indexOf(p, ':', 0);
            int equals = TopLevelSplitter.indexOfAssignment(p);
            if (colon < 0 || (equals >= 0 && equals < colon)) {
                continue;
            }
            String name = p.substring(0, colon).strip();
            String annotation = (equals < 0 ? p.substring(colon + 1) : p.substring(colon + 1, equals)).strip();
            if (NAME_TARGET.matcher(name).matches() && !annotation.isEmpty()) {
                names.putIfAbsent(qualified + "@" + name, new AnnotationSite(file, line, annotation));
            }
        }

        String rest = header.substring(close + 1).strip();
        if (rest.startsWith("->")) {
            int colon = TopLevelSplitter.indexOf(rest, ':', 2);
            String annotation = (colon < 0 ? rest.substring(2) : rest.substring(2, colon)).strip();
            if (!annotation.isEmpty()) {
                names.putIfAbsent(qualified + "::return", new AnnotationSite(file, line, annotation));
            }
        }
    }

    private void recordAssignment(Map<String, AnnotationSite> names, Scope scope, String text,
                                  String file, int line) {
        int colon = TopLevelSplitter.indexOf(text, ':', 0);
        if (colon <= 0) {
            return;
        }
        String target = text.substring(0, colon).strip();
        String remainder = text.substring(colon + 1);
        int equals = TopLevelSplitter.indexOfAssignment(remainder);
        String annotation = (equals < 0 ? remainder : remainder.substring(0, equals)).strip();
        if (annotation.isEmpty()) {
            return;
        }

        String qualified;
        Matcher self = SELF_TARGET.matcher(target);
        if (self.matches()) {
            if (scope.kind() != ScopeKind.FUNCTION || scope.owner() == null) {
                return;
            }
            qualified = scope.owner().qualifiedName() + "." + self.group(1);
        } else if (NAME_TARGET.matcher(target).matches() && !KEYWORDS.contains(target)) {
            if (!scope.recordable() || scope.kind() == ScopeKind.FUNCTION || SKIPPED_DUNDERS.contains(target)) {
                return;
            }
            qualified = scope.qualifiedName() + "." + target;
        } else {
            return;
        }

        String unwrapped = unwrapQualifier(annotation);
        if (unwrapped == null || TYPE_ALIAS.contains(unwrapped)) {
            return;
        }
        names.putIfAbsent(qualified, new AnnotationSite(file, line, unwrapped));
    }

    /**
     * {@code ClassVar[T]} and {@code Final[T]} declare {@code T}. A bare qualifier
     * leaves the type to inference and is not an annotation of interest.
     */
    private static @Nullable String unwrapQualifier(String annotation) {
        if (QUALIFIER_WRAPPERS.contains(annotation)) {
            return null;
        }
        int bracket = annotation.indexOf('[');
        if (bracket > 0 && annotation.endsWith("]")
                && QUALIFIER_WRAPPERS.contains(annotation.substring(0, bracket).strip())
                && TopLevelSplitter.matchingClose(annotation, bracket) == annotation.length() - 1) {
            return annotation.substring(bracket + 1, annotation.length() - 1).strip();
        }
        return annotation;
    }

    private enum ScopeKind {
        MODULE, CLASS, FUNCTION
    }

    /**
     * @param indent     indentation of the header line; body lines are deeper
     * @param recordable whether names declared directly in this scope are collected
     * @param owner      for methods, the class that {@code self} attributes belong to
     */
    private record Scope(ScopeKind kind, String qualifiedName, int indent, boolean recordable,
                         @Nullable Scope owner) {
    }
}

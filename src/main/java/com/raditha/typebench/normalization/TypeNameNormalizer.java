package com.raditha.typebench.normalization;

import java.util.List;
import java.util.Map;

/**
 * Maps the many spellings of a type constructor onto one canonical name.
 * {@code typing.List}, {@code List} and {@code list} all become {@code list}
 * so that later stages compare constructors rather than import styles.
 */
public class TypeNameNormalizer {

    private static final List<String> MODULE_PREFIXES = List.of(
            "typing_extensions.",
            "typing.",
            "builtins.",
            "collections.abc.",
            "collections.");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("List", "list"),
            Map.entry("Dict", "dict"),
            Map.entry("Set", "set"),
            Map.entry("FrozenSet", "frozenset"),
            Map.entry("Tuple", "tuple"),
            Map.entry("Type", "type"),
            Map.entry("DefaultDict", "defaultdict"),
            Map.entry("Text", "str"),
            Map.entry("NoneType", "None"));

    /**
     * Canonicalize a dotted constructor name.
     *
     * @param name name as written in the annotation, e.g. {@code typing.Dict}
     * @return canonical name, e.g. {@code dict}
     */
    public String canonicalize(String name) {
        String stripped = name.strip();
        for (String prefix : MODULE_PREFIXES) {
            if (stripped.startsWith(prefix) && stripped.length() > prefix.length()) {
                stripped = stripped.substring(prefix.length());
                break;
            }
        }
        return ALIASES.getOrDefault(stripped, stripped);
    }
}

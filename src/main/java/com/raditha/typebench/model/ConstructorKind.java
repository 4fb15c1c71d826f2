package com.raditha.typebench.model;

import java.util.Map;

/**
 * Enumerated constructor of a type annotation node.
 * The kind drives the affinity lookup in the similarity scorer, so every
 * canonical name resolves to exactly one kind.
 */
public enum ConstructorKind {
    /** The {@code None} type */
    NONE,
    /** {@code Any} */
    ANY,
    /** {@code object} */
    OBJECT,
    BOOL,
    INT,
    FLOAT,
    COMPLEX,
    STR,
    /** {@code bytes}, {@code bytearray}, {@code memoryview} */
    BYTES,
    LIST,
    TUPLE,
    SET,
    FROZENSET,
    /** {@code dict} and its concrete subclasses (defaultdict, OrderedDict, Counter) */
    DICT,
    /** Abstract ordered containers (Sequence, MutableSequence) */
    SEQUENCE,
    /** Abstract iteration protocols (Iterable, Iterator, Generator, Collection, ...) */
    ITERABLE,
    /** Abstract mappings (Mapping, MutableMapping) */
    MAPPING,
    /** Abstract sets (AbstractSet, MutableSet) */
    ABSTRACT_SET,
    CALLABLE,
    /** {@code type[X]} */
    TYPE,
    LITERAL,
    UNION,
    /** Bracketed argument list, e.g. the {@code [int, str]} in {@code Callable[[int, str], bool]} */
    PARAMETERS,
    /** The {@code ...} placeholder */
    ELLIPSIS,
    /** A literal value inside {@code Literal[...]} */
    VALUE,
    /** Any other named type (user classes, unknown library types) */
    CLASS,
    /** Raw text that could not be parsed */
    UNPARSED;

    private static final Map<String, ConstructorKind> BY_NAME = Map.ofEntries(
            Map.entry("None", NONE),
            Map.entry("Any", ANY),
            Map.entry("object", OBJECT),
            Map.entry("bool", BOOL),
            Map.entry("int", INT),
            Map.entry("float", FLOAT),
            Map.entry("complex", COMPLEX),
            Map.entry("str", STR),
            Map.entry("bytes", BYTES),
            Map.entry("bytearray", BYTES),
            Map.entry("memoryview", BYTES),
            Map.entry("list", LIST),
            Map.entry("tuple", TUPLE),
            Map.entry("set", SET),
            Map.entry("frozenset", FROZENSET),
            Map.entry("dict", DICT),
            Map.entry("defaultdict", DICT),
            Map.entry("OrderedDict", DICT),
            Map.entry("Counter", DICT),
            Map.entry("Sequence", SEQUENCE),
            Map.entry("MutableSequence", SEQUENCE),
            Map.entry("Iterable", ITERABLE),
            Map.entry("Iterator", ITERABLE),
            Map.entry("Generator", ITERABLE),
            Map.entry("Collection", ITERABLE),
            Map.entry("Reversible", ITERABLE),
            Map.entry("AsyncIterable", ITERABLE),
            Map.entry("AsyncIterator", ITERABLE),
            Map.entry("AsyncGenerator", ITERABLE),
            Map.entry("Mapping", MAPPING),
            Map.entry("MutableMapping", MAPPING),
            Map.entry("AbstractSet", ABSTRACT_SET),
            Map.entry("MutableSet", ABSTRACT_SET),
            Map.entry("Callable", CALLABLE),
            Map.entry("type", TYPE),
            Map.entry("Literal", LITERAL),
            Map.entry("Union", UNION));

    /**
     * Resolve the kind of a canonical (already normalized) type name.
     *
     * @param canonicalName name produced by the type name normalizer
     * @return the matching kind, {@link #CLASS} for anything unknown
     */
    public static ConstructorKind fromName(String canonicalName) {
        return BY_NAME.getOrDefault(canonicalName, CLASS);
    }

    /**
     * Kinds whose identity is carried entirely by the name or raw text.
     * Two nodes of these kinds with different names are unrelated.
     */
    public boolean isNominal() {
        return this == CLASS || this == VALUE || this == UNPARSED;
    }
}

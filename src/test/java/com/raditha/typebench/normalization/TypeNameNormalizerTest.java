package com.raditha.typebench.normalization;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeNameNormalizerTest {

    private final TypeNameNormalizer normalizer = new TypeNameNormalizer();

    @Test
    void testStripsModulePrefixes() {
        assertEquals("Mapping", normalizer.canonicalize("collections.abc.Mapping"));
        assertEquals("OrderedDict", normalizer.canonicalize("collections.OrderedDict"));
        assertEquals("int", normalizer.canonicalize("builtins.int"));
        assertEquals("Literal", normalizer.canonicalize("typing_extensions.Literal"));
    }

    @Test
    void testCapitalizedAliases() {
        assertEquals("list", normalizer.canonicalize("typing.List"));
        assertEquals("frozenset", normalizer.canonicalize("FrozenSet"));
        assertEquals("defaultdict", normalizer.canonicalize("DefaultDict"));
        assertEquals("type", normalizer.canonicalize("Type"));
    }

    @Test
    void testOtherNamesUnchanged() {
        assertEquals("myapp.User", normalizer.canonicalize("myapp.User"));
        assertEquals("Iterator", normalizer.canonicalize("Iterator"));
    }
}

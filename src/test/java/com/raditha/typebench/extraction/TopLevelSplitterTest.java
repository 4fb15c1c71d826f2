package com.raditha.typebench.extraction;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopLevelSplitterTest {

    @Test
    void testSplitIgnoresNestedAndQuotedDelimiters() {
        List<String> parts = TopLevelSplitter.split("a: Dict[str, int], b: str = 'x,y', c", ',');
        assertEquals(List.of("a: Dict[str, int]", " b: str = 'x,y'", " c"), parts);
    }

    @Test
    void testIndexOfAssignmentSkipsComparisons() {
        assertEquals(-1, TopLevelSplitter.indexOfAssignment("x == y"));
        assertEquals(-1, TopLevelSplitter.indexOfAssignment("x <= y"));
        assertEquals(-1, TopLevelSplitter.indexOfAssignment("n := 3"));
        assertEquals(7, TopLevelSplitter.indexOfAssignment("x: int = a == b"));
        assertEquals(-1, TopLevelSplitter.indexOfAssignment("f(a=1)"));
    }

    @Test
    void testMatchingClose() {
        String text = "f(a: Callable[[int], str], b)";
        assertEquals(text.length() - 1, TopLevelSplitter.matchingClose(text, 1));
        assertEquals(-1, TopLevelSplitter.matchingClose("f(a", 1));
    }

    @Test
    void testIndexOfSkipsStrings() {
        assertEquals(12, TopLevelSplitter.indexOf("d['a:b'] = x: 1", ':', 0));
    }
}

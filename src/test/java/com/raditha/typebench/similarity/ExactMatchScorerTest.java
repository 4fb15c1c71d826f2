package com.raditha.typebench.similarity;

import com.raditha.typebench.model.TypeNode;
import com.raditha.typebench.normalization.TypeExpressionParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExactMatchScorerTest {

    private final ExactMatchScorer scorer = new ExactMatchScorer();
    private final TypeExpressionParser parser = new TypeExpressionParser();

    private int exact(String predicted, String truth) {
        return scorer.exact(parser.parse(predicted).orElseThrow(), parser.parse(truth).orElseThrow());
    }

    @Test
    void testEqualAfterNormalization() {
        assertEquals(1, exact("typing.List[int]", "list[int]"));
        assertEquals(1, exact("Optional[int]", "Union[int, None]"));
        assertEquals(1, exact("Union[str, int]", "int | str"));
    }

    @Test
    void testArgumentOrderMattersOutsideUnions() {
        assertEquals(0, exact("dict[int, str]", "dict[str, int]"));
        assertEquals(0, exact("tuple[int, str]", "tuple[str, int]"));
    }

    @Test
    void testDifferentTypes() {
        assertEquals(0, exact("List[str]", "List[int]"));
        assertEquals(0, exact("int", "Optional[int]"));
    }

    @Test
    void testMissingPrediction() {
        TypeNode truth = TypeNode.leaf("int");
        assertEquals(0, scorer.exact(null, truth));
    }
}

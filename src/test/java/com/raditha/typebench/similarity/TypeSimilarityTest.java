package com.raditha.typebench.similarity;

import com.raditha.typebench.config.SimilarityPolicy;
import com.raditha.typebench.model.TypeNode;
import com.raditha.typebench.normalization.TypeExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TypeSimilarity with the default policy.
 */
class TypeSimilarityTest {

    private static final double EPS = 1e-9;

    private TypeSimilarity similarity;
    private TypeExpressionParser parser;

    @BeforeEach
    void setUp() {
        similarity = new TypeSimilarity();
        parser = new TypeExpressionParser();
    }

    private double sim(String predicted, String truth) {
        return similarity.similarity(parser.parse(predicted).orElseThrow(), parser.parse(truth).orElseThrow());
    }

    @Test
    void testIdenticalLeaves() {
        assertEquals(1.0, sim("int", "int"), EPS);
    }

    @Test
    void testMissingPredictionScoresZero() {
        TypeNode truth = parser.parse("Dict[str, List[int]]").orElseThrow();
        assertEquals(0.0, similarity.similarity(null, truth), EPS);
    }

    @Test
    void testSameConstructorWrongArgument() {
        // local 1.0, child 0.0, blended half and half
        assertEquals(0.5, sim("List[str]", "List[int]"), EPS);
    }

    @Test
    void testOptionalEqualsExplicitUnion() {
        assertEquals(1.0, sim("Optional[int]", "Union[int, None]"), EPS);
        assertEquals(1.0, sim("None | int", "Optional[int]"), EPS);
    }

    @Test
    void testRelatedContainerKinds() {
        // list~Sequence = 0.5, children identical
        assertEquals(0.75, sim("list[int]", "Sequence[int]"), EPS);
    }

    @Test
    void testSameKindDifferentName() {
        // Iterator~Generator = 0.75; one of three arguments matches: 1/3
        assertEquals(0.375 + 0.5 / 3.0, sim("Iterator[int]", "Generator[int, None, None]"), EPS);
    }

    @Test
    void testArgumentsOnOneSideOnly() {
        assertEquals(0.5, sim("list", "list[int]"), EPS);
        assertEquals(0.5, sim("list[int]", "list"), EPS);
    }

    @Test
    void testNumericTower() {
        assertEquals(0.5, sim("float", "int"), EPS);
        assertEquals(0.5, sim("bool", "int"), EPS);
        assertEquals(0.25, sim("complex", "int"), EPS);
        assertEquals(0.0, sim("str", "int"), EPS);
    }

    @Test
    void testUserClassesAreNominal() {
        assertEquals(0.0, sim("Account", "User"), EPS);
        assertEquals(1.0, sim("models.User", "models.User"), EPS);
    }

    @Test
    void testNonUnionAgainstUnionCountsAsOneBranch() {
        assertEquals(0.5, sim("int", "Optional[int]"), EPS);
        assertEquals(0.5, sim("Optional[int]", "int"), EPS);
    }

    @Test
    void testUnionBranchesMatchedRegardlessOfOrder() {
        assertEquals(0.5, sim("str | int", "int | None"), EPS);
        assertEquals(1.0, sim("Union[str, int, bytes]", "Union[bytes, str, int]"), EPS);
    }

    @Test
    void testNestedPartialCredit() {
        // dict~Mapping 0.5; children (1.0 + 0.5) / 2 = 0.75
        assertEquals(0.625, sim("dict[str, int]", "Mapping[str, float]"), EPS);
    }

    @Test
    void testSurplusArgumentsCostCredit() {
        // both shared positions match, divided by the longer argument list
        assertEquals(0.5 + 0.5 * (2.0 / 3.0), sim("Tuple[int, str, bytes]", "Tuple[int, str]"), EPS);
    }

    @Test
    void testUnparsedOnlyMatchesIdenticalText() {
        assertEquals(1.0, sim("List[int", "List[int"), EPS);
        assertEquals(0.0, sim("List[int", "List[str"), EPS);
    }

    @Test
    void testCustomPolicyChangesBlend() {
        SimilarityPolicy policy = SimilarityPolicy.defaults().withOverrides(0.8, 0.75, List.of());
        TypeSimilarity weighted = new TypeSimilarity(policy);
        TypeNode predicted = parser.parse("List[str]").orElseThrow();
        TypeNode truth = parser.parse("List[int]").orElseThrow();
        assertEquals(0.8, weighted.similarity(predicted, truth), EPS);
    }
}

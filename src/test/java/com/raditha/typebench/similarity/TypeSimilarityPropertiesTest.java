package com.raditha.typebench.similarity;

import com.raditha.typebench.model.TypeNode;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.Tuple;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties that hold for every pair of type trees.
 */
class TypeSimilarityPropertiesTest {

    private final TypeSimilarity similarity = new TypeSimilarity();
    private final ExactMatchScorer exactScorer = new ExactMatchScorer();

    @Property(tries = 200)
    void identicalTreesScoreOne(@ForAll("types") TypeNode type) {
        assertEquals(1.0, similarity.similarity(type, type), 1e-12);
    }

    @Property(tries = 200)
    void missingPredictionScoresZero(@ForAll("types") TypeNode truth) {
        assertEquals(0.0, similarity.similarity(null, truth));
        assertEquals(0, exactScorer.exact(null, truth));
    }

    @Property(tries = 300)
    void scoreStaysWithinBounds(@ForAll("types") TypeNode predicted, @ForAll("types") TypeNode truth) {
        double score = similarity.similarity(predicted, truth);
        assertTrue(score >= 0.0 && score <= 1.0, "score out of range: " + score);
    }

    @Property(tries = 300)
    void exactMatchImpliesFullSimilarity(@ForAll("types") TypeNode predicted, @ForAll("types") TypeNode truth) {
        if (exactScorer.exact(predicted, truth) == 1) {
            assertEquals(1.0, similarity.similarity(predicted, truth), 1e-12);
        }
    }

    @Property(tries = 300)
    void replacingAMismatchedArgumentNeverLowersTheScore(
            @ForAll("constructors") String name,
            @ForAll("argumentLists") List<TypeNode> truthArgs,
            @ForAll("argumentLists") List<TypeNode> predictedArgs) {
        int arity = Math.min(truthArgs.size(), predictedArgs.size());
        TypeNode truth = TypeNode.generic(name, truthArgs.subList(0, arity));
        List<TypeNode> guessed = new ArrayList<>(predictedArgs.subList(0, arity));
        TypeNode predicted = TypeNode.generic(name, guessed);
        double before = similarity.similarity(predicted, truth);

        for (int i = 0; i < arity; i++) {
            if (!guessed.get(i).equals(truth.children().get(i))) {
                guessed.set(i, truth.children().get(i));
                double after = similarity.similarity(TypeNode.generic(name, guessed), truth);
                assertTrue(after >= before - 1e-12, "score dropped from " + before + " to " + after);
                before = after;
            }
        }
    }

    @Provide
    Arbitrary<TypeNode> types() {
        return typesOfDepth(3);
    }

    @Provide
    Arbitrary<String> constructors() {
        return Arbitraries.of("list", "dict", "tuple", "Sequence", "Callable", "Box");
    }

    @Provide
    Arbitrary<List<TypeNode>> argumentLists() {
        return typesOfDepth(2).list().ofMinSize(1).ofMaxSize(4);
    }

    private Arbitrary<TypeNode> leaves() {
        return Arbitraries.of("int", "str", "float", "bool", "bytes", "None", "Any", "User", "Order")
                .map(TypeNode::leaf);
    }

    private Arbitrary<TypeNode> typesOfDepth(int depth) {
        if (depth == 0) {
            return leaves();
        }
        Arbitrary<TypeNode> inner = typesOfDepth(depth - 1);
        Arbitrary<TypeNode> generics = Combinators.combine(
                        Arbitraries.of("list", "dict", "tuple", "set", "Sequence", "Iterable", "Mapping"),
                        inner.list().ofMinSize(1).ofMaxSize(3))
                .as(TypeNode::generic);
        Arbitrary<TypeNode> unions = inner.list().ofMinSize(2).ofMaxSize(3).map(TypeNode::union);
        return Arbitraries.frequencyOf(
                Tuple.of(3, leaves()),
                Tuple.of(2, generics),
                Tuple.of(1, unions));
    }
}

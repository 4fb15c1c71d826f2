package com.raditha.typebench.similarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BranchMatcherTest {

    private final BranchMatcher matcher = new BranchMatcher();

    @Test
    void testBestPairsTakenFirst() {
        double[][] scores = {
                {0.5, 0.9},
                {0.9, 0.1}
        };
        List<BranchMatcher.Match> matches = matcher.match(scores);

        assertEquals(2, matches.size());
        assertEquals(new BranchMatcher.Match(0, 1, 0.9), matches.get(0));
        assertEquals(new BranchMatcher.Match(1, 0, 0.9), matches.get(1));
        assertEquals(0.9, matcher.matchedAverage(scores, 2, 2), 1e-9);
    }

    @Test
    void testTiesGoToLowerTruthThenLowerPredictedIndex() {
        double[][] scores = {
                {1.0, 1.0},
                {1.0, 0.0}
        };
        List<BranchMatcher.Match> matches = matcher.match(scores);

        // greedy: (0,0) first, which leaves only (1,1)
        assertEquals(new BranchMatcher.Match(0, 0, 1.0), matches.get(0));
        assertEquals(new BranchMatcher.Match(1, 1, 0.0), matches.get(1));
        assertEquals(0.5, matcher.matchedAverage(scores, 2, 2), 1e-9);
    }

    @Test
    void testUnmatchedBranchesOnlyCountInDenominator() {
        double[][] scores = {
                {1.0},
                {0.0},
                {0.0}
        };
        assertEquals(1, matcher.match(scores).size());
        assertEquals(1.0 / 3.0, matcher.matchedAverage(scores, 3, 1), 1e-9);
    }

    @Test
    void testEachBranchUsedOnce() {
        double[][] scores = {
                {1.0, 0.2, 0.3},
        };
        List<BranchMatcher.Match> matches = matcher.match(scores);
        assertEquals(1, matches.size());
        assertEquals(0, matches.get(0).predictedIndex());
        assertEquals(1.0 / 3.0, matcher.matchedAverage(scores, 1, 3), 1e-9);
    }

    @Test
    void testEmpty() {
        assertTrue(matcher.match(new double[0][0]).isEmpty());
        assertEquals(0.0, matcher.matchedAverage(new double[0][0], 0, 0));
    }
}

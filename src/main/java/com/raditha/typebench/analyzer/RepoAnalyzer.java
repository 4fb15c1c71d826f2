package com.raditha.typebench.analyzer;

import com.raditha.typebench.extraction.AnnotationSite;
import com.raditha.typebench.extraction.PythonAnnotationExtractor;
import com.raditha.typebench.model.ConstructorKind;
import com.raditha.typebench.model.RepoTask;
import com.raditha.typebench.model.ScoreRecord;
import com.raditha.typebench.model.TypeNode;
import com.raditha.typebench.model.Variable;
import com.raditha.typebench.model.VariableId;
import com.raditha.typebench.normalization.TypeExpressionParser;
import com.raditha.typebench.similarity.ExactMatchScorer;
import com.raditha.typebench.similarity.TypeSimilarity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pairs every ground-truth variable of a repository with its prediction and scores it.
 * <p>
 * Targets are the annotated names of the truth tree, except
 * <ul>
 * <li>names whose ground truth is {@code Any}, which carry no information</li>
 * <li>names the baseline tree already annotates with something other than {@code Any},
 * which were never left for the predictor to fill in</li>
 * </ul>
 * A target with no counterpart in the prediction tree is missing.
 */
public class RepoAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RepoAnalyzer.class);

    private final PythonAnnotationExtractor extractor;
    private final TypeExpressionParser parser;
    private final TypeSimilarity similarity;
    private final ExactMatchScorer exactScorer;

    public RepoAnalyzer(TypeSimilarity similarity) {
        this(new PythonAnnotationExtractor(), new TypeExpressionParser(), similarity, new ExactMatchScorer());
    }

    public RepoAnalyzer(PythonAnnotationExtractor extractor, TypeExpressionParser parser,
                        TypeSimilarity similarity, ExactMatchScorer exactScorer) {
        this.extractor = extractor;
        this.parser = parser;
        this.similarity = similarity;
        this.exactScorer = exactScorer;
    }

    /**
     * Score all targets of a repository.
     *
     * @throws IOException if the truth or prediction tree cannot be read
     */
    public RepoAnalysis analyze(RepoTask task) throws IOException {
        Map<String, AnnotationSite> truth = extractor.extract(task.truthTree());
        Map<String, AnnotationSite> predicted = extractor.extract(task.predictionTree());
        Map<String, AnnotationSite> baseline = task.baselineTree() != null
                ? extractor.extract(task.baselineTree())
                : Map.of();

        List<Variable> variables = new ArrayList<>();
        List<ScoreRecord> records = new ArrayList<>();
        int skippedAny = 0;
        int skippedBaseline = 0;

        for (Map.Entry<String, AnnotationSite> entry : truth.entrySet()) {
            Optional<TypeNode> truthType = parser.parse(entry.getValue().annotation());
            if (truthType.isEmpty() || truthType.get().kind() == ConstructorKind.ANY) {
                skippedAny++;
                continue;
            }
            if (isAnnotatedInBaseline(baseline.get(entry.getKey()))) {
                skippedBaseline++;
                continue;
            }

            AnnotationSite site = entry.getValue();
            AnnotationSite predictedSite = predicted.get(entry.getKey());
            TypeNode predictedType = predictedSite == null
                    ? null
                    : parser.parse(predictedSite.annotation()).orElse(null);

            Variable variable = new Variable(
                    new VariableId(site.file(), entry.getKey(), site.line()),
                    truthType.get(),
                    predictedType);
            variables.add(variable);
            records.add(score(variable));
        }

        logger.debug("{}: {} targets, {} skipped as Any, {} already annotated in baseline",
                task.name(), variables.size(), skippedAny, skippedBaseline);
        return new RepoAnalysis(task.name(), variables, records);
    }

    /**
     * Score one variable.
     */
    public ScoreRecord score(Variable variable) {
        TypeNode predicted = variable.predicted();
        return new ScoreRecord(
                variable.id().key(),
                similarity.similarity(predicted, variable.truth()),
                exactScorer.exact(predicted, variable.truth()),
                variable.depth(),
                variable.truth().render(),
                predicted == null ? null : predicted.render(),
                variable.isMissing());
    }

    private boolean isAnnotatedInBaseline(@Nullable AnnotationSite site) {
        if (site == null) {
            return false;
        }
        return parser.parse(site.annotation())
                .map(node -> node.kind() != ConstructorKind.ANY)
                .orElse(false);
    }
}

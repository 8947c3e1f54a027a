/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.factory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.opensearch.anomalyensemble.processor.AnomalyScoreEnsembleWorkflow;
import org.opensearch.anomalyensemble.processor.AnomalyScoreEnsembler;
import org.opensearch.anomalyensemble.processor.combination.ArithmeticMeanScoreCombinationTechnique;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombinationFactory;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombinationTechnique;
import org.opensearch.anomalyensemble.processor.normalization.QuantileScoreNormalizationTechnique;
import org.opensearch.anomalyensemble.processor.normalization.ScoreNormalizationFactory;
import org.opensearch.anomalyensemble.processor.normalization.ScoreNormalizationTechnique;

import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;

import static org.opensearch.anomalyensemble.util.ConfigurationUtils.checkNoUnsupportedProperties;
import static org.opensearch.anomalyensemble.util.ConfigurationUtils.readOptionalMap;
import static org.opensearch.anomalyensemble.util.ConfigurationUtils.readStringProperty;

/**
 * Factory for anomaly score ensembler. Instantiates ensembler based on user provided input.
 */
@AllArgsConstructor
@Log4j2
public class AnomalyScoreEnsemblerFactory {
    public static final String NORMALIZATION_CLAUSE = "normalization";
    public static final String COMBINATION_CLAUSE = "combination";
    public static final String TECHNIQUE = "technique";
    public static final String PARAMETERS = "parameters";

    private final AnomalyScoreEnsembleWorkflow ensembleWorkflow;
    private final ScoreNormalizationFactory scoreNormalizationFactory;
    private final ScoreCombinationFactory scoreCombinationFactory;

    /**
     * Create ensembler from configuration, normalization and combination clauses are optional
     * @param tag identifier of the ensembler
     * @param description free text description of the ensembler
     * @param config configuration in form of nested maps, not mutated
     * @return configured ensembler
     */
    public AnomalyScoreEnsembler create(final String tag, final String description, final Map<String, Object> config) {
        Map<String, Object> configuration = Objects.isNull(config) ? new HashMap<>() : new HashMap<>(config);

        Map<String, Object> normalizationClause = readOptionalMap(AnomalyScoreEnsembler.TYPE, tag, configuration, NORMALIZATION_CLAUSE);
        ScoreNormalizationTechnique normalizationTechnique = ScoreNormalizationFactory.DEFAULT_METHOD;
        if (Objects.nonNull(normalizationClause)) {
            Map<String, Object> clause = new HashMap<>(normalizationClause);
            String normalizationTechniqueName = readStringProperty(
                AnomalyScoreEnsembler.TYPE,
                tag,
                clause,
                TECHNIQUE,
                QuantileScoreNormalizationTechnique.TECHNIQUE_NAME
            );
            Map<String, Object> normalizationParams = readOptionalMap(AnomalyScoreEnsembler.TYPE, tag, clause, PARAMETERS);
            checkNoUnsupportedProperties(AnomalyScoreEnsembler.TYPE, tag, clause);
            normalizationTechnique = scoreNormalizationFactory.createNormalization(normalizationTechniqueName, normalizationParams);
        }

        Map<String, Object> combinationClause = readOptionalMap(AnomalyScoreEnsembler.TYPE, tag, configuration, COMBINATION_CLAUSE);
        ScoreCombinationTechnique scoreCombinationTechnique = ScoreCombinationFactory.DEFAULT_METHOD;
        if (Objects.nonNull(combinationClause)) {
            Map<String, Object> clause = new HashMap<>(combinationClause);
            String combinationTechnique = readStringProperty(
                AnomalyScoreEnsembler.TYPE,
                tag,
                clause,
                TECHNIQUE,
                ArithmeticMeanScoreCombinationTechnique.TECHNIQUE_NAME
            );
            // check for optional combination params
            Map<String, Object> combinationParams = readOptionalMap(AnomalyScoreEnsembler.TYPE, tag, clause, PARAMETERS);
            checkNoUnsupportedProperties(AnomalyScoreEnsembler.TYPE, tag, clause);
            scoreCombinationTechnique = scoreCombinationFactory.createCombination(combinationTechnique, combinationParams);
        }
        checkNoUnsupportedProperties(AnomalyScoreEnsembler.TYPE, tag, configuration);

        log.info(
            "Creating anomaly score ensembler of type [{}] with normalization [{}] and combination [{}]",
            AnomalyScoreEnsembler.TYPE,
            normalizationTechnique.describe(),
            scoreCombinationTechnique.describe()
        );
        return new AnomalyScoreEnsembler(tag, description, normalizationTechnique, scoreCombinationTechnique, ensembleWorkflow);
    }
}

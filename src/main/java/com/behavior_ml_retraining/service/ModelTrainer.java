package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.dto.feature.FeatureRow;
import com.behavior_ml_retraining.dto.feature.FeatureTable;
import com.behavior_ml_retraining.dto.model.BehaviorPrediction;
import com.behavior_ml_retraining.dto.model.ModelArtifactSet;
import com.behavior_ml_retraining.dto.train.EvaluationMetrics;
import com.behavior_ml_retraining.dto.train.TrainingResult;
import com.behavior_ml_retraining.exception.ModelTrainingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import weka.classifiers.Classifier;
import weka.classifiers.Evaluation;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.Standardize;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fits the churn classifier and the spending regressor (Weka random forests) on a shared,
 * standardized feature space, and scores artifact sets on prepared feature tables.
 */
@Service
@Slf4j
public class ModelTrainer {

    static final String CHURN_CLASS = "will_churn";
    static final String SPENDING_CLASS = "spending_score";
    static final List<String> CHURN_VALUES = List.of("no", "yes");

    private static final double TRAIN_FRACTION = 0.7;

    private final int numTrees;
    private final int seed;

    @Autowired
    public ModelTrainer(@Value("${retraining.trainer.num-trees:100}") int numTrees,
                        @Value("${retraining.trainer.seed:42}") int seed) {
        this.numTrees = numTrees;
        this.seed = seed;
    }

    /**
     * Trains a candidate set on a seeded 70/30 split of {@code table} and reports its scores on the 30%.
     */
    public TrainingResult train(FeatureTable table) {
        if (table.size() < 2) {
            throw new ModelTrainingException("At least two feature rows are required, got " + table.size());
        }
        log.info("🧠 Training candidate models on {} feature rows [trees={}, seed={}]", table.size(), numTrees, seed);

        try {
            Instances features = toFeatureInstances(table);
            Standardize scaler = new Standardize();
            scaler.setInputFormat(features);
            Instances scaled = Filter.useFilter(features, scaler);

            Instances churnData = withChurnLabels(scaled, table);
            Instances spendingData = withSpendingLabels(scaled, table);
            churnData.randomize(new Random(seed));
            spendingData.randomize(new Random(seed));

            int trainSize = Math.max(1, (int) (churnData.numInstances() * TRAIN_FRACTION));
            int testSize = churnData.numInstances() - trainSize;
            if (testSize == 0) {
                trainSize--;
                testSize = 1;
            }

            Instances churnTrain = new Instances(churnData, 0, trainSize);
            Instances churnTest = new Instances(churnData, trainSize, testSize);
            Instances spendingTrain = new Instances(spendingData, 0, trainSize);
            Instances spendingTest = new Instances(spendingData, trainSize, testSize);

            log.info("📊 Building churn classifier on {} rows", churnTrain.numInstances());
            Classifier classifier = newForest();
            classifier.buildClassifier(churnTrain);

            log.info("📈 Building spending regressor on {} rows", spendingTrain.numInstances());
            Classifier regressor = newForest();
            regressor.buildClassifier(spendingTrain);

            EvaluationMetrics trainMetrics = score(classifier, regressor, churnTest, spendingTest);
            log.info("✅ Candidate trained: accuracy={}, mse={} on {} held-back rows",
                    String.format("%.3f", trainMetrics.accuracy()),
                    String.format("%.2f", trainMetrics.errorMetric()),
                    trainMetrics.samplesUsed());

            return new TrainingResult(new ModelArtifactSet(null, classifier, regressor, scaler), trainMetrics);
        } catch (ModelTrainingException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelTrainingException("Training failed: " + e.getMessage(), e);
        }
    }

    /**
     * Scores the classifier (accuracy) and the regressor (mean squared error) of {@code artifacts} on {@code table}.
     */
    public EvaluationMetrics evaluate(ModelArtifactSet artifacts, FeatureTable table) {
        if (table.isEmpty()) {
            throw new ModelTrainingException("Cannot evaluate on an empty feature table");
        }
        try {
            Instances scaled = scale(artifacts.featureScaler(), toFeatureInstances(table));
            return score(artifacts.classifier(), artifacts.regressor(),
                    withChurnLabels(scaled, table), withSpendingLabels(scaled, table));
        } catch (ModelTrainingException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelTrainingException("Evaluation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Churn probability and predicted spending (floored at zero) for one prepared feature row.
     */
    public BehaviorPrediction predict(ModelArtifactSet artifacts, Long userId, FeatureRow row) {
        FeatureTable single = new FeatureTable(List.of(row));
        try {
            Instances scaled = scale(artifacts.featureScaler(), toFeatureInstances(single));
            Instance churnInstance = withChurnLabels(scaled, single).instance(0);
            Instance spendingInstance = withSpendingLabels(scaled, single).instance(0);

            double[] distribution = artifacts.classifier().distributionForInstance(churnInstance);
            double churnProbability = distribution.length > 1 ? distribution[1] : 0.0;
            double spending = Math.max(0.0, artifacts.regressor().classifyInstance(spendingInstance));
            return new BehaviorPrediction(userId, churnProbability, spending);
        } catch (Exception e) {
            throw new ModelTrainingException("Prediction failed for user " + userId + ": " + e.getMessage(), e);
        }
    }

    private EvaluationMetrics score(Classifier classifier, Classifier regressor,
                                    Instances churnTest, Instances spendingTest) throws Exception {
        Evaluation churnEval = new Evaluation(churnTest);
        churnEval.evaluateModel(classifier, churnTest);

        Evaluation spendingEval = new Evaluation(spendingTest);
        spendingEval.evaluateModel(regressor, spendingTest);

        double rmse = spendingEval.rootMeanSquaredError();
        return new EvaluationMetrics(churnEval.pctCorrect() / 100.0, rmse * rmse, churnTest.numInstances());
    }

    private RandomForest newForest() {
        RandomForest forest = new RandomForest();
        forest.setNumIterations(numTrees);
        forest.setSeed(seed);
        return forest;
    }

    // Filters keep internal state, so a shared production scaler is applied one batch at a time.
    private static Instances scale(Standardize scaler, Instances features) throws Exception {
        synchronized (scaler) {
            return Filter.useFilter(features, scaler);
        }
    }

    static Instances toFeatureInstances(FeatureTable table) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : FeatureRow.FEATURE_NAMES) {
            attributes.add(new Attribute(name));
        }
        Instances data = new Instances("behavior_features", attributes, table.size());
        for (FeatureRow row : table.rows()) {
            data.add(new DenseInstance(1.0, row.features()));
        }
        return data;
    }

    private static Instances withChurnLabels(Instances scaled, FeatureTable table) {
        Instances data = labeledHeader("churn", new Attribute(CHURN_CLASS, CHURN_VALUES), table.size());
        for (int i = 0; i < scaled.numInstances(); i++) {
            double label = table.rows().get(i).willChurn() ? 1.0 : 0.0;
            data.add(new DenseInstance(1.0, append(scaled.instance(i).toDoubleArray(), label)));
        }
        return data;
    }

    private static Instances withSpendingLabels(Instances scaled, FeatureTable table) {
        Instances data = labeledHeader("spending", new Attribute(SPENDING_CLASS), table.size());
        for (int i = 0; i < scaled.numInstances(); i++) {
            double label = table.rows().get(i).spendingScore();
            data.add(new DenseInstance(1.0, append(scaled.instance(i).toDoubleArray(), label)));
        }
        return data;
    }

    private static Instances labeledHeader(String relation, Attribute classAttribute, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : FeatureRow.FEATURE_NAMES) {
            attributes.add(new Attribute(name));
        }
        attributes.add(classAttribute);
        Instances data = new Instances(relation, attributes, capacity);
        data.setClassIndex(attributes.size() - 1);
        return data;
    }

    private static double[] append(double[] values, double last) {
        double[] out = new double[values.length + 1];
        System.arraycopy(values, 0, out, 0, values.length);
        out[values.length] = last;
        return out;
    }
}

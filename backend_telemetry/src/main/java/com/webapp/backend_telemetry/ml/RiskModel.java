package com.webapp.backend_telemetry.ml;

import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A fitted scaler and forest. Instances are never mutated after {@link #fit};
 * retraining builds a new one.
 */
public final class RiskModel {
    public static final List<String> FEATURE_NAMES = List.of(
            "runtime_ms", "cpu_usage_percent", "memory_peak_kb", "page_faults_minor", "page_faults_major");

    private final FeatureScaler scaler;
    private final RandomForest forest;
    private final Instances header;
    private final int trainingSize;
    private final int realRows;

    private RiskModel(FeatureScaler scaler, RandomForest forest, Instances header, int trainingSize, int realRows) {
        this.scaler = scaler;
        this.forest = forest;
        this.header = header;
        this.trainingSize = trainingSize;
        this.realRows = realRows;
    }

    public static RiskModel fit(double[][] features, RiskLabel[] labels, int trees, int seed, int realRows) {
        if (features.length != labels.length) {
            throw new IllegalArgumentException("Got " + features.length + " feature rows but " + labels.length + " labels");
        }
        FeatureScaler scaler = FeatureScaler.fit(features);

        Instances data = new Instances("sandbox-telemetry", attributes(), features.length);
        data.setClassIndex(FEATURE_NAMES.size());
        for (int i = 0; i < features.length; i++) {
            double[] values = Arrays.copyOf(scaler.transform(features[i]), FEATURE_NAMES.size() + 1);
            values[FEATURE_NAMES.size()] = labels[i].ordinal();
            data.add(new DenseInstance(1.0, values));
        }

        RandomForest forest = new RandomForest();
        forest.setNumIterations(trees);
        forest.setSeed(seed);
        try {
            forest.buildClassifier(data);
        } catch (Exception e) {
            throw new ModelTrainingException("Random forest training failed on " + features.length + " rows", e);
        }
        return new RiskModel(scaler, forest, new Instances(data, 0), features.length, realRows);
    }

    /**
     * Class probabilities indexed by {@link RiskLabel#ordinal()}.
     */
    public double[] distribution(double[] rawFeatures) throws Exception {
        double[] values = Arrays.copyOf(scaler.transform(rawFeatures), FEATURE_NAMES.size() + 1);
        values[FEATURE_NAMES.size()] = Utils.missingValue();
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return forest.distributionForInstance(instance);
    }

    public int getTrainingSize() {
        return trainingSize;
    }

    public int getRealRows() {
        return realRows;
    }

    public boolean isTrained() {
        return trainingSize > 0;
    }

    private static ArrayList<Attribute> attributes() {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : FEATURE_NAMES) {
            attributes.add(new Attribute(name));
        }
        List<String> classValues = Arrays.stream(RiskLabel.values())
                .map(RiskLabel::getDisplayName)
                .collect(Collectors.toList());
        attributes.add(new Attribute("label", classValues));
        return attributes;
    }
}

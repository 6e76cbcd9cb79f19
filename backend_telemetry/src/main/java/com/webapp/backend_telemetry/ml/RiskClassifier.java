package com.webapp.backend_telemetry.ml;

import com.webapp.backend_telemetry.config.TelemetryProperties;
import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.ModelInfoDto;
import com.webapp.backend_telemetry.dtos.RiskPrediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Random forest over five raw run signals, blended with {@link SeedDataset} on
 * every fit. The constructor fits the seed set, so {@link #predict} is usable
 * before any real runs exist.
 */
@Slf4j
@Component
public class RiskClassifier {
    public static final String MODEL_TYPE = "RandomForestClassifier";

    private final TelemetryProperties.Classifier settings;
    private volatile RiskModel model;

    public RiskClassifier(TelemetryProperties properties) {
        this.settings = properties.getClassifier();
        if (settings.getTrees() < 1) {
            throw new IllegalArgumentException("telemetry.classifier.trees must be positive");
        }
        this.model = fit(List.of());
    }

    /**
     * Refits on seed plus {@code rows}. Batches smaller than the configured
     * minimum leave the current model in place.
     */
    public void train(List<FeatureRow> rows) {
        if (rows == null || rows.size() < settings.getMinTrainingRows()) {
            log.debug("Skipping retrain: {} rows, need {}", rows == null ? 0 : rows.size(), settings.getMinTrainingRows());
            return;
        }
        List<FeatureRow> real = rows;
        if (settings.getMaxRealRows() > 0 && rows.size() > settings.getMaxRealRows()) {
            real = rows.subList(0, settings.getMaxRealRows());
        }
        try {
            model = fit(real);
            log.info("Classifier retrained on {} seed + {} real rows", SeedDataset.SAMPLES.size(), real.size());
        } catch (ModelTrainingException | IllegalArgumentException e) {
            log.error("Retrain failed, keeping previous model", e);
        }
    }

    public RiskPrediction predict(FeatureRow row) {
        return predict(getModel(), row);
    }

    /**
     * Classifies {@code row} with a specific fitted model, typically the one
     * captured alongside a cached feature table.
     */
    public RiskPrediction predict(RiskModel fitted, FeatureRow row) {
        RiskModel active = fitted;
        if (active == null || !active.isTrained()) {
            active = fit(List.of());
        }
        double[] distribution;
        try {
            distribution = active.distribution(toVector(row));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Forest could not classify run " + row.getSource(), e);
        }

        int best = 0;
        for (int i = 1; i < distribution.length; i++) {
            if (distribution[i] > distribution[best]) best = i;
        }
        RiskLabel label = RiskLabel.values()[best];
        return RiskPrediction.builder()
                .prediction(label)
                .confidence(Math.round(distribution[best] * 1000.0) / 10.0)
                .reason(explain(label, row))
                .build();
    }

    public Optional<RiskPrediction> tryPredict(RiskModel fitted, FeatureRow row) {
        try {
            return Optional.of(predict(fitted, row));
        } catch (RuntimeException e) {
            log.warn("Prediction failed for {}: {}", row == null ? null : row.getSource(), e.getMessage());
            return Optional.empty();
        }
    }

    public String explain(RiskLabel label, FeatureRow row) {
        return RiskExplainer.explain(label, row);
    }

    public boolean isTrained() {
        RiskModel current = model;
        return current != null && current.isTrained();
    }

    public RiskModel getModel() {
        return model;
    }

    public ModelInfoDto modelInfo() {
        return modelInfo(getModel());
    }

    public ModelInfoDto modelInfo(RiskModel fitted) {
        return ModelInfoDto.builder()
                .modelType(MODEL_TYPE)
                .features(RiskModel.FEATURE_NAMES)
                .trained(fitted != null && fitted.isTrained())
                .trainingSize(fitted == null ? 0 : fitted.getTrainingSize())
                .realRows(fitted == null ? 0 : fitted.getRealRows())
                .build();
    }

    static double[] toVector(FeatureRow row) {
        double[] vector = {
                row.getRuntimeMs(),
                row.getPeakCpu(),
                row.getPeakMemoryKb(),
                row.getPageFaultsMinor(),
                row.getPageFaultsMajor()
        };
        for (int i = 0; i < vector.length; i++) {
            if (!Double.isFinite(vector[i])) {
                throw new IllegalArgumentException(RiskModel.FEATURE_NAMES.get(i) + " is not finite: " + vector[i]);
            }
        }
        return vector;
    }

    private RiskModel fit(List<FeatureRow> real) {
        int size = SeedDataset.SAMPLES.size() + real.size();
        double[][] features = new double[size][];
        RiskLabel[] labels = new RiskLabel[size];

        int i = 0;
        for (SeedDataset.Sample sample : SeedDataset.SAMPLES) {
            features[i] = sample.getFeatures().clone();
            labels[i++] = sample.getLabel();
        }
        for (FeatureRow row : real) {
            features[i] = toVector(row);
            labels[i++] = ExitReasonLabeler.label(row);
        }
        return RiskModel.fit(features, labels, settings.getTrees(), settings.getSeed(), real.size());
    }
}

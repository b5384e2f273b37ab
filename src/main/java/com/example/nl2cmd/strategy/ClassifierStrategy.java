package com.example.nl2cmd.strategy;

import com.example.nl2cmd.classifier.IntentClassifier;
import com.example.nl2cmd.classifier.Prediction;
import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class ClassifierStrategy implements ResolutionStrategy {

    private static final String NAME = "classifier";

    private final IntentClassifier classifier;
    private final double threshold;

    public ClassifierStrategy(Optional<IntentClassifier> classifier, Nl2CmdProperties properties) {
        this.classifier = classifier.orElse(null);
        this.threshold = properties.getResolver().getClassifierThreshold();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.ML;
    }

    @Override
    public boolean isAvailable() {
        return classifier != null && classifier.isAvailable();
    }

    @Override
    public CandidateResolution resolve(ProcessedQuery query, OsFamily os) {
        if (!isAvailable()) {
            return CandidateResolution.failed(ResolutionMethod.ML, "Classifier not available");
        }
        try {
            Prediction prediction = classifier.predict(query.getNormalized());
            if (prediction.label() == null) {
                return CandidateResolution.failed(ResolutionMethod.ML, "No intent predicted");
            }
            Optional<String> command = classifier.labelToCommand(prediction.label(), os);
            if (command.isEmpty()) {
                return CandidateResolution.failed(ResolutionMethod.ML,
                        "No " + os.key() + " command for intent " + prediction.label());
            }
            double confidence = prediction.confidence();
            return CandidateResolution.builder()
                    .method(ResolutionMethod.ML)
                    .command(command.get())
                    .confidence(confidence)
                    .success(confidence >= threshold)
                    .intent(prediction.label())
                    .meta("classifier", classifier.name())
                    .build();
        } catch (RuntimeException ex) {
            log.warn("Classifier {} failed for '{}': {}", classifier.name(), query.getOriginal(), ex.getMessage());
            return CandidateResolution.failed(ResolutionMethod.ML, "ML prediction failed: " + ex.getMessage());
        }
    }
}

package com.example.retrain;

import com.example.retrain.ledger.AttemptLedger;
import com.example.retrain.ledger.RetrainAttempt;
import com.example.retrain.lifecycle.CanaryHealthCheck;
import com.example.retrain.lifecycle.FileSystemArtifactStore;
import com.example.retrain.lifecycle.HealthCheck;
import com.example.retrain.lifecycle.ModelLifecycleManager;
import com.example.retrain.ml.ModelTrainer;
import com.example.retrain.ml.OlsModelTrainer;
import com.example.retrain.ml.TrainingOrchestrator;
import com.example.retrain.pipeline.RetrainProperties;
import com.example.retrain.store.ConsumptionMark;
import com.example.retrain.store.JsonLinesLog;
import com.example.retrain.store.SampleStore;
import com.example.retrain.store.SampleValidator;
import com.example.retrain.store.SeedDataset;
import com.example.retrain.store.TrainingSample;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Configuration class for the retraining pipeline's durable state and collaborators.
 *
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Lay out the data directory ({@code retrain.data-dir}):
 *       {@code samples.jsonl}, {@code consumed.jsonl}, {@code attempts.jsonl} and {@code models/}.</li>
 *   <li>Provide the pluggable {@link ModelTrainer} and post-promotion {@link HealthCheck};
 *       both back off when the application defines its own.</li>
 *   <li>Provide the UTC {@link Clock} every component reads time from.</li>
 * </ul>
 *
 * Storage uses its own {@link ObjectMapper} (see {@link #storageMapper()}) so the on-disk format
 * does not change with web serialization settings.
 */
@Configuration
public class DefaultConfiguration {

    /** JSON settings for every persisted record: ISO-8601 instants, tolerant of added fields. */
    public static ObjectMapper storageMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SampleStore sampleStore(RetrainProperties props, Clock clock) {
        ObjectMapper om = storageMapper();
        Path dir = dataDir(props);
        return new SampleStore(
                new JsonLinesLog<>(dir.resolve("samples.jsonl"), om, TrainingSample.class, TrainingSample::receivedAt),
                new JsonLinesLog<>(dir.resolve("consumed.jsonl"), om, ConsumptionMark.class, ConsumptionMark::consumedAt),
                new SampleValidator(props.getMaxLabel()),
                clock);
    }

    @Bean
    AttemptLedger attemptLedger(RetrainProperties props) {
        return new AttemptLedger(new JsonLinesLog<>(dataDir(props).resolve("attempts.jsonl"),
                storageMapper(), RetrainAttempt.class, RetrainAttempt::startedAt));
    }

    @Bean
    @ConditionalOnMissingBean
    ModelTrainer modelTrainer(RetrainProperties props) {
        return new OlsModelTrainer(props.getHoldoutFraction(), props.getSplitSeed());
    }

    @Bean
    TrainingOrchestrator trainingOrchestrator(ModelTrainer trainer, RetrainProperties props, Clock clock) {
        return new TrainingOrchestrator(trainer, props.getTrainingTimeout(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    HealthCheck healthCheck(RetrainProperties props) {
        return new CanaryHealthCheck(props.getMaxLabel());
    }

    @Bean
    ModelLifecycleManager modelLifecycleManager(RetrainProperties props, HealthCheck healthCheck) {
        return new ModelLifecycleManager(
                new FileSystemArtifactStore(dataDir(props).resolve("models"), storageMapper()),
                healthCheck,
                props.getBackupRetentionCount());
    }

    @Bean
    SeedDataset seedDataset(RetrainProperties props, ResourceLoader resources) {
        String location = props.getSeedCsv();
        return location == null || location.isBlank()
                ? new SeedDataset(List.of())
                : SeedDataset.load(resources.getResource(location));
    }

    private static Path dataDir(RetrainProperties props) {
        return Paths.get(props.getDataDir());
    }
}

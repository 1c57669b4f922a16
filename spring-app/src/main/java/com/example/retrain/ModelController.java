package com.example.retrain;

import com.example.retrain.dto.HousingFeatures;
import com.example.retrain.dto.ModelView;
import com.example.retrain.dto.PredictionView;
import com.example.retrain.lifecycle.ModelArtifact;
import com.example.retrain.lifecycle.ModelLifecycleManager;
import com.example.retrain.lifecycle.RollbackResult;
import com.example.retrain.store.FeatureDomain;
import com.example.retrain.store.SampleValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1/model")
public class ModelController {

    private final ModelLifecycleManager lifecycle;
    private final Clock clock;

    public ModelController(ModelLifecycleManager lifecycle, Clock clock) {
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    @GetMapping
    public ModelView view() {
        ModelArtifact a = lifecycle.current().orElseThrow(NoCurrentModelException::new);
        return new ModelView(a.version(), a.trainedAt(), a.ageDays(clock.instant()), a.metrics(),
                a.model().coefficients().clone(), lifecycle.backupVersions());
    }

    /** Scores with whatever artifact is current at the instant of the call. */
    @PostMapping("/predict")
    public PredictionView predict(@RequestBody HousingFeatures features) {
        List<String> missing = new ArrayList<>();
        for (FeatureDomain d : FeatureDomain.values()) {
            if (features == null || d.valueOf(features) == null) missing.add(d.column() + ": required");
        }
        if (!missing.isEmpty()) throw new SampleValidationException(missing);
        ModelArtifact a = lifecycle.current().orElseThrow(NoCurrentModelException::new);
        return new PredictionView(a.model().predict(features.toVector()), a.version());
    }

    @PostMapping("/rollback")
    public Mono<RollbackResult> rollback() {
        return Mono.fromCallable(lifecycle::rollback)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(r -> log.info("Manual rollback: rolledBack={}, from=v{}, to=v{}",
                        r.rolledBack(), r.fromVersion(), r.toVersion()));
    }
}

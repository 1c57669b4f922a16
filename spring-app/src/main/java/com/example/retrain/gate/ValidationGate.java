package com.example.retrain.gate;

import com.example.retrain.ml.ModelMetrics;
import com.example.retrain.pipeline.RetrainProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Non-regression gate between a trained candidate and the serving baseline.
 * <p>
 * Accepts when {@code candidate.rmse <= baseline.rmse * (1 + regression-tolerance)}.
 * Candidates with missing or non-finite metrics, or evaluated on fewer than
 * {@code min-validation-samples} rows, are rejected with their own codes.
 */
@Slf4j
@Component
public class ValidationGate {

    private final RetrainProperties props;

    public ValidationGate(RetrainProperties props) {
        this.props = props;
    }

    public GateVerdict evaluate(ModelMetrics candidate, ModelMetrics baseline) {
        GateVerdict v = judge(candidate, baseline);
        if (v.accepted()) log.info("Gate accepted candidate: {}", v.detail());
        else log.warn("Gate rejected candidate ({}): {}", v.code(), v.detail());
        return v;
    }

    private GateVerdict judge(ModelMetrics candidate, ModelMetrics baseline) {
        if (candidate == null) {
            return new GateVerdict(GateVerdict.Code.MISSING_METRICS, "candidate has no metrics");
        }
        if (!candidate.isFinite()) {
            return new GateVerdict(GateVerdict.Code.NON_FINITE_METRICS,
                    "candidate metrics are not finite: " + candidate);
        }
        if (candidate.validationSize() < props.getMinValidationSamples()) {
            return new GateVerdict(GateVerdict.Code.TOO_FEW_VALIDATION_SAMPLES,
                    "validated on " + candidate.validationSize() + " rows < " + props.getMinValidationSamples());
        }
        if (baseline == null || !Double.isFinite(baseline.rmse())) {
            return new GateVerdict(GateVerdict.Code.ACCEPTED_WITHOUT_BASELINE,
                    fmt("candidate rmse %.4f, no usable baseline", candidate.rmse()));
        }
        double limit = baseline.rmse() * (1.0 + props.getRegressionTolerance());
        String cmp = fmt("candidate rmse %.4f vs baseline %.4f (limit %.4f, tolerance %.2f%%)",
                candidate.rmse(), baseline.rmse(), limit, props.getRegressionTolerance() * 100);
        return candidate.rmse() <= limit
                ? new GateVerdict(GateVerdict.Code.ACCEPTED, cmp)
                : new GateVerdict(GateVerdict.Code.REGRESSION, cmp);
    }

    private static String fmt(String f, Object... args) {
        return String.format(Locale.ROOT, f, args);
    }
}

package com.example.retrain;

import com.example.retrain.dto.BatchSubmitResponse;
import com.example.retrain.dto.SampleRequest;
import com.example.retrain.dto.StatusView;
import com.example.retrain.dto.SubmitResponse;
import com.example.retrain.dto.TriggerRequest;
import com.example.retrain.dto.TriggerResponse;
import com.example.retrain.pipeline.RetrainPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Reactive HTTP surface of the retraining pipeline.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li><b>POST</b> {@code /v1/retrain/samples} – one labeled sample; 400 with violations when invalid.</li>
 *   <li><b>POST</b> {@code /v1/retrain/samples/batch} – many samples; per-item errors, never all-or-nothing.</li>
 *   <li><b>GET</b> {@code /v1/retrain/status} – pending count, model age, policy decision, recent attempts.</li>
 *   <li><b>POST</b> {@code /v1/retrain/trigger} – manual retrain, see {@link TriggerRequest}.</li>
 * </ul>
 *
 * File I/O is offloaded to {@code boundedElastic}; training itself never runs on the request thread.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * curl -s -H 'Content-Type: application/json' \
 *      -d '{"reason":"new census batch","force":false,"wait":true}' \
 *      http://127.0.0.1:8080/v1/retrain/trigger | jq
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping("/v1/retrain")
@RequiredArgsConstructor
public class RetrainController {

    private final RetrainPipeline pipeline;

    @PostMapping(path = "/samples", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<SubmitResponse> submit(@RequestBody SampleRequest request) {
        return Mono.fromCallable(() -> pipeline.submit(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(path = "/samples/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BatchSubmitResponse> submitBatch(@RequestBody List<SampleRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Empty batch"));
        }
        return Mono.fromCallable(() -> pipeline.submitBatch(requests))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(r -> log.info("Batch of {}: accepted={}, failed={}, pending={}",
                        requests.size(), r.accepted_count(), r.failed_count(), r.total_pending()));
    }

    @GetMapping("/status")
    public Mono<StatusView> status() {
        return Mono.fromCallable(pipeline::status)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/trigger")
    public Mono<TriggerResponse> trigger(@RequestBody(required = false) TriggerRequest request) {
        TriggerRequest r = request == null ? new TriggerRequest(null, null, null) : request;
        return pipeline.trigger(r.reasonOrDefault(), r.forced(), r.waitForCompletion())
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(resp -> log.info("Trigger request: reason={}, force={}, outcome={}",
                        r.reasonOrDefault(), r.forced(), resp.outcome()));
    }
}

package dev.careerpath.pipeline;

import dev.careerpath.config.PipelineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of in-flight and recently finished runs. Finished runs are evicted after the
 * configured TTL; late subscribers inside that window still get the full event replay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunRegistry {

    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();
    private final PipelineConfig pipelineConfig;

    PipelineRun register(PipelineRun run) {
        runs.put(run.getId(), run);
        return run;
    }

    Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    PipelineRun require(RunHandle handle) {
        if (handle == null) {
            throw new UnknownRunException("null");
        }
        return find(handle.id()).orElseThrow(() -> new UnknownRunException(handle.id()));
    }

    /**
     * Schedule removal of a finished run after the TTL expires.
     */
    void scheduleEviction(String runId) {
        Mono.delay(pipelineConfig.getRunTtl())
                .subscribe(tick -> {
                    runs.remove(runId);
                    log.debug("Evicted run {}", runId);
                });
    }

    public int size() {
        return runs.size();
    }
}

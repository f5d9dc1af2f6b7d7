package com.auditeng.backend.service;

import com.auditeng.backend.model.AnalysisStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Tracks the pipeline running for each analysis id. At most one live run per id.
 */
@Component
public class AnalysisTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalysisTaskRegistry.class);

    private final Executor executor;
    private final ConcurrentMap<String, CancellationToken> running = new ConcurrentHashMap<>();

    public AnalysisTaskRegistry(@Qualifier("analysisExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * Schedules a run. A cancelled run still finishing in the background is replaced; it can no
     * longer commit because its attempt is stale.
     *
     * @throws AnalysisConflictException when a live run exists for the id
     * @throws RejectedExecutionException when the executor is saturated
     */
    public CancellationToken submit(String analysisId, int attempt, Consumer<CancellationToken> work) {
        CancellationToken token = new CancellationToken(attempt);
        CancellationToken previous = running.compute(analysisId,
                (id, current) -> current == null || current.isCancelled() ? token : current);
        if (previous != token) {
            throw new AnalysisConflictException(analysisId, AnalysisStatus.PROCESSING,
                    "Analysis " + analysisId + " is already being processed");
        }

        try {
            executor.execute(() -> {
                try {
                    work.accept(token);
                } finally {
                    running.remove(analysisId, token);
                }
            });
        } catch (RejectedExecutionException e) {
            running.remove(analysisId, token);
            throw e;
        }
        log.debug("[PIPELINE] Scheduled analysis {} attempt {}", analysisId, attempt);
        return token;
    }

    /**
     * @return true when a live run was signalled
     */
    public boolean cancel(String analysisId) {
        CancellationToken token = running.get(analysisId);
        if (token == null || token.isCancelled()) {
            return false;
        }
        token.cancel();
        return true;
    }

    public boolean isRunning(String analysisId) {
        CancellationToken token = running.get(analysisId);
        return token != null && !token.isCancelled();
    }
}

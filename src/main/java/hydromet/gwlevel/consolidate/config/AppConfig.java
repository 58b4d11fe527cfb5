package hydromet.gwlevel.consolidate.config;

import hydromet.gwlevel.consolidate.util.RunIdUtil;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the consolidation pipeline
 */
@Configuration
public class AppConfig {

    /**
     * Validation and reshaping: one task per file, no shared state
     */
    @Bean(name = "fileProcessingExecutor")
    public ThreadPoolTaskExecutor fileProcessingExecutor(ConsolidationConfig config) {
        ConsolidationConfig.Executors settings = config.getExecutors();
        return buildExecutor("File-Processing-", settings.getFileProcessingThreads(), settings);
    }

    /**
     * Region consolidation: one task per region, single-threaded within a region
     */
    @Bean(name = "regionConsolidationExecutor")
    public ThreadPoolTaskExecutor regionConsolidationExecutor(ConsolidationConfig config) {
        ConsolidationConfig.Executors settings = config.getExecutors();
        return buildExecutor("Region-Consolidation-", settings.getRegionConsolidationThreads(), settings);
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int threads, ConsolidationConfig.Executors settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(prefix);

        // Run in the submitting thread when the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // Carry the run id into worker threads so their log lines can be correlated
        executor.setTaskDecorator(runIdPropagation());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());

        executor.initialize();
        return executor;
    }

    static TaskDecorator runIdPropagation() {
        return task -> {
            String runId = RunIdUtil.hasRunId() ? RunIdUtil.getCurrentRunId() : null;
            return () -> {
                if (runId != null) {
                    RunIdUtil.setRunId(runId);
                }
                try {
                    task.run();
                } finally {
                    if (runId != null) {
                        RunIdUtil.clearRunId();
                    }
                }
            };
        };
    }
}

package fr.imt.scanzilla.scanzilla.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AnalysisExecutorConfiguration {

    public static final String ANALYSIS_EXECUTOR = "analysisExecutor";

    /**
     * One thread per repository analyzed at the same time; extra repositories wait in the queue.
     */
    @Bean(name = ANALYSIS_EXECUTOR)
    public ThreadPoolTaskExecutor analysisExecutor(ScanzillaProperties properties) {
        int width = Math.max(1, properties.getAnalysis().getBatchWidth());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(width);
        executor.setMaxPoolSize(width);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}

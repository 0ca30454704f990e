package github.sarthakdev143.reel_factory.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the single thread that hosts the render worker loop.
 */
@Configuration
@EnableConfigurationProperties(RenderProperties.class)
public class RenderWorkerConfig {

    @Bean(name = "renderWorkerExecutor")
    public ThreadPoolTaskExecutor renderWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        // room for the relaunch a dying worker schedules from its own thread
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("render-worker-");
        // the loop never finishes on its own, shutdown interrupts it
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}

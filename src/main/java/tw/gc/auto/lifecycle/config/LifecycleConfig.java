package tw.gc.auto.lifecycle.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.lifecycle.AppConstants;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class LifecycleConfig {

    @Bean
    public Clock clock() {
        return Clock.system(AppConstants.TAIPEI_ZONE);
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, TrainingProperties trainingProperties) {
        Duration timeout = Duration.ofMillis(trainingProperties.getBridge().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    /**
     * Workers that advance one family's pipeline at a time. Training itself never runs here;
     * a worker only dispatches, polls or decides and then returns.
     */
    @Bean(name = "lifecycleWorkers")
    public ThreadPoolTaskExecutor lifecycleWorkers(LifecycleProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkers());
        executor.setMaxPoolSize(properties.getWorkers());
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("lifecycle-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}

package com.tracker.infrastructure.config;

import com.tracker.application.service.RetryPolicy;
import com.tracker.infrastructure.context.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class WebhookConfig {

    @Bean
    public ThreadPoolTaskExecutor webhookExecutor(AppProperties appProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(appProperties.getWebhook().getPoolSize());
        executor.setMaxPoolSize(appProperties.getWebhook().getPoolSize());
        executor.setThreadNamePrefix("webhook-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public HttpClient webhookHttpClient(AppProperties appProperties, ThreadPoolTaskExecutor webhookExecutor) {
        return HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofMillis(appProperties.getWebhook().getConnectTimeoutMs()))
            .followRedirects(HttpClient.Redirect.NEVER)
            .executor(webhookExecutor)
            .build();
    }

    @Bean
    public RetryPolicy webhookRetryPolicy(AppProperties appProperties) {
        AppProperties.Webhook webhook = appProperties.getWebhook();
        return RetryPolicy.exponential(
            webhook.getMaxAttempts(),
            Duration.ofMillis(webhook.getInitialDelayMs()),
            webhook.getMultiplier(),
            Duration.ofMillis(webhook.getMaxDelayMs())
        );
    }
}

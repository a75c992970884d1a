package com.codefarm.shorturl.config;

import com.codefarm.shorturl.logging.LogSink;
import com.codefarm.shorturl.logging.NoOpLogSink;
import com.codefarm.shorturl.logging.RemoteLogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class LogSinkConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LogSinkConfiguration.class);

    @Bean
    public ThreadPoolTaskExecutor logSinkExecutor(
            @Value("${shorturl.log-sink.threads:2}") int threads,
            @Value("${shorturl.log-sink.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("log-sink-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public LogSink logSink(
            @Value("${shorturl.log-sink.enabled:true}") boolean enabled,
            @Value("${shorturl.log-sink.base-url:}") String baseUrl,
            @Value("${shorturl.log-sink.path:/evaluation-service/logs}") String path,
            @Value("${shorturl.log-sink.timeout:5s}") Duration timeout,
            @Value("${shorturl.log-sink.auth-token:}") String authToken,
            @Qualifier("logSinkExecutor") ThreadPoolTaskExecutor logSinkExecutor,
            RestClient.Builder restClientBuilder) {
        if (!enabled || baseUrl.isBlank()) {
            log.info("Remote log sink disabled");
            return new NoOpLogSink();
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        RestClient restClient = restClientBuilder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
        log.info("Remote log sink enabled: {}{} (timeout {} ms)", baseUrl, path, timeout.toMillis());
        return new RemoteLogSink(restClient, path, logSinkExecutor, authToken);
    }
}

package com.github.dimitryivaniuta.apigateway.config;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wiring of the forwarding path:
 * - system UTC clock (replaced in tests)
 * - bounded executor for blocking backend exchanges
 * - TimeLimiter + scheduler bounding each call by gateway.backend.timeout
 * - RestClient on the JDK HttpClient, redirects relayed not followed
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "backendExecutor")
    public ThreadPoolTaskExecutor backendExecutor(GatewayProperties props) {
        int size = props.getBackend().getPoolSize();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("backend-");
        ex.setCorePoolSize(size);
        ex.setMaxPoolSize(size);
        ex.setQueueCapacity(size * 16);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        return ex;
    }

    @Bean(name = "backendTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService backendTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backend-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public TimeLimiter backendTimeLimiter(GatewayProperties props) {
        return TimeLimiter.of("backend", TimeLimiterConfig.custom()
                .timeoutDuration(props.getBackend().getTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Bean(name = "backendRestClient")
    public RestClient backendRestClient(RestClient.Builder builder, GatewayProperties props) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(props.getBackend().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(http);
        rf.setReadTimeout(props.getBackend().getTimeout());
        return builder.clone().requestFactory(rf).build();
    }
}

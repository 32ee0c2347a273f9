package com.phillippitts.holderbot.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the oracle executor via Micrometer.
 *
 * <p>Gauges: {@code oracle.pool.size}, {@code oracle.pool.active}, {@code oracle.pool.queued},
 * {@code oracle.pool.completed}, available at {@code /actuator/metrics} and as Prometheus
 * {@code oracle_pool_*}. Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> oracleExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("oracleExecutor") ObjectProvider<ThreadPoolTaskExecutor> oracleExecutorProvider) {
        this.oracleExecutorProvider = oracleExecutorProvider;
    }

    @Bean
    public MeterBinder oracleExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = oracleExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("oracle.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the oracle pool")
                    .register(registry);

            Gauge.builder("oracle.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively calling the oracle")
                    .register(registry);

            Gauge.builder("oracle.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of region calls waiting in the queue")
                    .register(registry);

            Gauge.builder("oracle.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed region calls")
                    .register(registry);

            LOG.info("Oracle thread pool metrics registered: oracle.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = oracleExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Oracle Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}

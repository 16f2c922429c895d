package guraa.uicompare.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for the thread pool running the comparison engines.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    private final int availableProcessors = Runtime.getRuntime().availableProcessors();

    @Value("${app.concurrency.comparison-threads:4}")
    @Getter @Setter
    private int comparisonThreads = Math.min(4, availableProcessors);

    /**
     * Executor for the visual and structural engines. Each comparison submits two tasks.
     */
    @Bean(name = "comparisonExecutor", destroyMethod = "shutdown")
    public ExecutorService comparisonExecutor() {
        int threads = Math.max(2, comparisonThreads);
        log.info("Creating comparison executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, createThreadFactory("compare-", Thread.NORM_PRIORITY));
    }

    /**
     * Create a thread factory with proper naming, priority and error handling.
     *
     * @param prefix Thread name prefix
     * @param priority Thread priority
     * @return A ThreadFactory
     */
    private ThreadFactory createThreadFactory(String prefix, int priority) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setPriority(priority);
                thread.setDaemon(true);

                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));

                return thread;
            }
        };
    }
}

package guraa.doccompare.config;

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
 * Configuration for the thread pool that runs per-page comparison work.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    private final int availableProcessors = Runtime.getRuntime().availableProcessors();

    @Value("${app.concurrency.page-comparison-threads:4}")
    @Getter @Setter
    private int pageComparisonThreads = Math.min(4, availableProcessors);

    /**
     * Executor for page comparison workers. Spring shuts it down with the context.
     */
    @Bean(name = "pageComparisonExecutor", destroyMethod = "shutdown")
    public ExecutorService pageComparisonExecutor() {
        int threads = Math.max(1, pageComparisonThreads);
        log.info("Creating page comparison executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, createThreadFactory("page-compare-"));
    }

    /**
     * Create a thread factory with proper naming and error handling.
     *
     * @param prefix Thread name prefix
     * @return A ThreadFactory
     */
    public static ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setDaemon(true);

                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));

                return thread;
            }
        };
    }
}

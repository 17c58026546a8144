package guraa.doccompare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the document comparison engine.
 */
@Slf4j
@SpringBootApplication
public class DocumentCompareApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        // Fingerprints are computed with java.awt imaging, which must not need a display
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        ApplicationContext context = SpringApplication.run(DocumentCompareApplication.class, args);

        Duration startupTime = Duration.between(startTime, Instant.now());
        log.info("==========================================================");
        log.info("Document comparison engine started in {} ms", startupTime.toMillis());
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("  Engine parallelism: {}",
                context.getBean(DocumentComparisonEngine.class).getDefaultOptions().getParallelism());
        log.info("==========================================================");
    }
}

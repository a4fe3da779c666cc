package guraa.renderverify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the rendering verification service.
 */
@Slf4j
@SpringBootApplication
public class RenderVerifyApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        // Captures are decoded and compared without a display
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        SpringApplication.run(RenderVerifyApplication.class, args);

        Duration startupTime = Duration.between(startTime, Instant.now());
        log.info("==========================================================");
        log.info("Render verify service started in {} ms", startupTime.toMillis());
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  OS: {} {}", System.getProperty("os.name"), System.getProperty("os.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("==========================================================");
    }

    @EventListener
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Application is shutting down, releasing comparison resources...");
    }
}

package guraa.renderverify.config;

import guraa.renderverify.core.ErrorHistogramValidator;
import guraa.renderverify.visual.ErrorHistogramCalculator;
import guraa.renderverify.visual.ToleranceCurveStretcher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for the comparison thread pool and the stateless comparison helpers.
 */
@Configuration
public class ExecutorConfig {

    @Value("${app.comparison.threads:4}")
    private int comparisonThreads;

    /**
     * Thread pool running one task per image comparison.
     *
     * @return The executor service
     */
    @Bean(name = "comparisonExecutor", destroyMethod = "shutdownNow")
    public ExecutorService comparisonExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("comparison-" + counter.incrementAndGet());
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, comparisonThreads), threadFactory);
    }

    @Bean
    public ErrorHistogramCalculator errorHistogramCalculator(AppProperties properties) {
        return new ErrorHistogramCalculator(properties.getComparison().getChannelMode());
    }

    @Bean
    public ErrorHistogramValidator errorHistogramValidator() {
        return new ErrorHistogramValidator();
    }

    @Bean
    public ToleranceCurveStretcher toleranceCurveStretcher() {
        return new ToleranceCurveStretcher();
    }
}

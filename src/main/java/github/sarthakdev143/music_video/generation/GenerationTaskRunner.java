package github.sarthakdev143.music_video.generation;

import github.sarthakdev143.music_video.config.MusicVideoProperties;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.support.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Runs a list of generation calls one after another with a fixed pause between items so the
 * upstream rate limits are respected. A failing item is reported to the handler and the batch
 * moves on.
 */
@Component
public class GenerationTaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(GenerationTaskRunner.class);

    private final Duration throttleDelay;
    private final Sleeper sleeper;
    private final Counter itemCounter;
    private final Counter failureCounter;

    @Autowired
    public GenerationTaskRunner(MusicVideoProperties properties, MeterRegistry meterRegistry) {
        this(properties.generation().throttleDelay(), Sleeper.system(), meterRegistry);
    }

    public GenerationTaskRunner(Duration throttleDelay, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.throttleDelay = throttleDelay;
        this.sleeper = sleeper;
        this.itemCounter = meterRegistry.counter("music_video.batch.items");
        this.failureCounter = meterRegistry.counter("music_video.batch.failures");
    }

    public <T, R> BatchSummary runBatch(
            List<T> items,
            ItemGenerator<T, R> generator,
            BatchItemHandler<T, R> handler) {
        if (items == null || items.isEmpty()) {
            return BatchSummary.empty();
        }

        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        long usageCost = 0L;

        for (T item : items) {
            attempted++;
            itemCounter.increment();
            try {
                GenerationResult<R> result = generator.generate(item);
                usageCost += result.usageCost();
                handler.onSuccess(item, result);
                succeeded++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failureCounter.increment();
                handler.onFailure(item, e);
                return new BatchSummary(attempted, succeeded, failed + 1, usageCost, true);
            } catch (Exception e) {
                failed++;
                failureCounter.increment();
                logger.error("Batch item {} of {} failed", attempted, items.size(), e);
                handler.onFailure(item, e);
            }

            try {
                sleeper.sleep(throttleDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Batch interrupted after {} of {} items", attempted, items.size());
                return new BatchSummary(attempted, succeeded, failed, usageCost, true);
            }
        }

        return new BatchSummary(attempted, succeeded, failed, usageCost, false);
    }
}

package ai.docsite.plaintext.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs conversion progress as a percentage spread over a fixed number of stages.
 */
public class StatusReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatusReporter.class);

    private final int totalStages;
    private int stage = -1;
    private int stageItems;
    private int completedItems;

    public StatusReporter(int totalStages) {
        if (totalStages < 1) {
            throw new IllegalArgumentException("totalStages must be at least 1");
        }
        this.totalStages = totalStages;
    }

    public void createStage(int items, String message) {
        stage = Math.min(stage + 1, totalStages);
        stageItems = Math.max(0, items);
        completedItems = 0;
        log(message, null);
    }

    public void report(String message, String file) {
        if (completedItems < stageItems) {
            completedItems++;
        }
        log(message, file);
    }

    public double percent() {
        if (stage < 0) {
            return 0.0;
        }
        double withinStage = stageItems == 0 ? 0.0 : (double) completedItems / stageItems;
        return Math.min(100.0, (stage + withinStage) * 100.0 / totalStages);
    }

    private void log(String message, String file) {
        if (message == null) {
            LOGGER.info("[{}%] {}", Math.round(percent()), file);
        } else if (file == null || file.isBlank()) {
            LOGGER.info("[{}%] {}", Math.round(percent()), message);
        } else {
            LOGGER.info("[{}%] {}: {}", Math.round(percent()), message, file);
        }
    }
}

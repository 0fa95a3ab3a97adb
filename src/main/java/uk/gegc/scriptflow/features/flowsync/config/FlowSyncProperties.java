package uk.gegc.scriptflow.features.flowsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for screenplay/flow synchronization
 */
@Component
@ConfigurationProperties(prefix = "scriptflow.sync")
@Data
public class FlowSyncProperties {

    /**
     * Deepest child page level visited by a push or created by a pull (root page is depth 0)
     */
    private int maxTreeDepth = 20;

    private Layout layout = new Layout();

    @Data
    public static class Layout {

        /**
         * Horizontal coordinate of the root page column
         */
        private double centerX = 400.0;

        /**
         * Horizontal space reserved for one leaf branch
         */
        private double branchGap = 350.0;

        private double startY = 100.0;

        private double rowSpacing = 150.0;
    }
}

package com.router.config;

import com.router.model.Integration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Planning and integration settings.
 */
@Data
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    /**
     * Upper bound of the planning loop; larger configured values are lowered to it.
     */
    public static final int STEP_CAP = 7;

    /**
     * Directory holding {@code <namespace>.md} usage guides.
     */
    private String guidesDir = "guides";

    /**
     * Iteration limit of the dynamic planning loop, kept within {@code 1..STEP_CAP}.
     */
    private int maxSteps = STEP_CAP;

    public int effectiveMaxSteps() {
        return Math.max(1, Math.min(maxSteps, STEP_CAP));
    }

    private List<IntegrationEntry> integrations = new ArrayList<>();

    @Data
    public static class IntegrationEntry {
        private String id;
        private String name;
        private String description = "";

        public Integration toIntegration() {
            return new Integration(id, name == null || name.isBlank() ? id : name, description);
        }
    }
}

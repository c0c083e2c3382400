package cobol.mapper.config;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiled paragraph naming conventions. Patterns are searched, not fully matched.
 */
public record NamingRules(
        Pattern trace,
        Pattern anomaly,
        Pattern shared,
        Pattern keyed
) {
    public NamingRules {
        Objects.requireNonNull(trace, "trace");
        Objects.requireNonNull(anomaly, "anomaly");
        Objects.requireNonNull(shared, "shared");
        Objects.requireNonNull(keyed, "keyed");
    }

    public boolean isTraceRoutine(String name) {
        return trace.matcher(name).find();
    }

    public boolean isAnomaly(String name) {
        return anomaly.matcher(name).find();
    }

    public boolean isShared(String name) {
        return shared.matcher(name).find();
    }

    public boolean isKeyed(String name) {
        return keyed.matcher(name).find();
    }
}

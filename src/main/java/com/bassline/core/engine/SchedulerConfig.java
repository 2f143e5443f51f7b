package com.bassline.core.engine;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tuning knobs for {@link PropagationScheduler}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class SchedulerConfig {

    /** Contact pops allowed in one pass before it is aborted as non-convergent. */
    @Builder.Default
    private final int maxSteps = 10_000;

    /** How long the scheduler waits for one gadget future. */
    @Builder.Default
    private final long gadgetTimeoutMillis = 5_000;

    /** Skip pure gadgets whose inputs are identical to their last invocation. */
    @Builder.Default
    private final boolean memoizePureGadgets = true;

    public static SchedulerConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code maxSteps}, {@code gadgetTimeoutMillis} and
     * {@code memoizePureGadgets} from a settings map. Missing keys keep their
     * defaults; values may be numbers, booleans or their string forms.
     */
    public static SchedulerConfig fromProperties(Map<String, Object> props) {
        SchedulerConfig d = defaults();
        if (props == null || props.isEmpty())
            return d;
        return builder()
                .maxSteps(getInt(props, "maxSteps", d.getMaxSteps()))
                .gadgetTimeoutMillis(getLong(props, "gadgetTimeoutMillis", d.getGadgetTimeoutMillis()))
                .memoizePureGadgets(getBoolean(props, "memoizePureGadgets", d.isMemoizePureGadgets()))
                .build();
    }

    static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
    }

    static long getLong(Map<String, Object> props, String key, long def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.longValue() : Long.parseLong(v.toString());
    }

    static boolean getBoolean(Map<String, Object> props, String key, boolean def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
    }
}

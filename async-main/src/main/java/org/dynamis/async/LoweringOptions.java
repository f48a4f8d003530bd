package org.dynamis.async;

import org.dynamis.async.emit.JoinStrategy;
import org.dynamis.async.liveness.HoistingStrategy;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable settings of a lowering run.
 */
public final class LoweringOptions {

    public static final String PREFIX_PROPERTY = "dynamis.async.prefix";
    public static final String HOISTING_PROPERTY = "dynamis.async.hoisting";
    public static final String JOIN_STRATEGY_PROPERTY = "dynamis.async.joinStrategy";
    public static final String GENERATOR_MARKERS_PROPERTY = "dynamis.async.generatorMarkers";

    public static final String DEFAULT_PREFIX = "__";
    public static final String DEFAULT_GENERATOR_MARKER = "org.dynamis.async.runtime.Async.yieldValue";

    private static final LoweringOptions DEFAULTS = builder().build();

    private final String namePrefix;
    private final HoistingStrategy hoistingStrategy;
    private final JoinStrategy joinStrategy;
    private final Set<String> generatorMarkers;

    private LoweringOptions(Builder builder) {
        this.namePrefix = builder.namePrefix;
        this.hoistingStrategy = builder.hoistingStrategy;
        this.joinStrategy = builder.joinStrategy;
        this.generatorMarkers = Set.copyOf(builder.generatorMarkers);
    }

    public static LoweringOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code dynamis.async.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not valid for its key
     */
    public static LoweringOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String prefix = properties.getProperty(PREFIX_PROPERTY);
        if (prefix != null) {
            builder.namePrefix(prefix.trim());
        }
        String hoisting = properties.getProperty(HOISTING_PROPERTY);
        if (hoisting != null) {
            builder.hoistingStrategy(parseEnum(HoistingStrategy.class, HOISTING_PROPERTY, hoisting));
        }
        String join = properties.getProperty(JOIN_STRATEGY_PROPERTY);
        if (join != null) {
            builder.joinStrategy(parseEnum(JoinStrategy.class, JOIN_STRATEGY_PROPERTY, join));
        }
        String markers = properties.getProperty(GENERATOR_MARKERS_PROPERTY);
        if (markers != null) {
            builder.generatorMarkers(Arrays.stream(markers.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        return builder.build();
    }

    public static LoweringOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + key
                    + ", expected one of " + Arrays.toString(type.getEnumConstants()), e);
        }
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public HoistingStrategy getHoistingStrategy() {
        return hoistingStrategy;
    }

    public JoinStrategy getJoinStrategy() {
        return joinStrategy;
    }

    public Set<String> getGeneratorMarkers() {
        return generatorMarkers;
    }

    public Builder toBuilder() {
        return builder()
                .namePrefix(namePrefix)
                .hoistingStrategy(hoistingStrategy)
                .joinStrategy(joinStrategy)
                .generatorMarkers(generatorMarkers);
    }

    @Override
    public String toString() {
        return "LoweringOptions{prefix='" + namePrefix + "', hoisting=" + hoistingStrategy
                + ", join=" + joinStrategy + ", generatorMarkers=" + generatorMarkers + '}';
    }

    public static final class Builder {

        private String namePrefix = DEFAULT_PREFIX;
        private HoistingStrategy hoistingStrategy = HoistingStrategy.POSITIONAL;
        private JoinStrategy joinStrategy = JoinStrategy.COMPLETION_SIGNAL;
        private Set<String> generatorMarkers = Set.of(DEFAULT_GENERATOR_MARKER);

        private Builder() {}

        public Builder namePrefix(String namePrefix) {
            Objects.requireNonNull(namePrefix, "namePrefix");
            if (namePrefix.isEmpty() || !Character.isJavaIdentifierStart(namePrefix.charAt(0))
                    || !namePrefix.chars().allMatch(Character::isJavaIdentifierPart)) {
                throw new IllegalArgumentException("Generated-name prefix must be a Java identifier: '" + namePrefix + "'");
            }
            this.namePrefix = namePrefix;
            return this;
        }

        public Builder hoistingStrategy(HoistingStrategy hoistingStrategy) {
            this.hoistingStrategy = Objects.requireNonNull(hoistingStrategy, "hoistingStrategy");
            return this;
        }

        public Builder joinStrategy(JoinStrategy joinStrategy) {
            this.joinStrategy = Objects.requireNonNull(joinStrategy, "joinStrategy");
            return this;
        }

        public Builder generatorMarkers(Set<String> generatorMarkers) {
            this.generatorMarkers = new LinkedHashSet<>(Objects.requireNonNull(generatorMarkers, "generatorMarkers"));
            return this;
        }

        public LoweringOptions build() {
            return new LoweringOptions(this);
        }
    }
}

package org.dynamis.async;

import org.dynamis.async.emit.JoinStrategy;
import org.dynamis.async.liveness.HoistingStrategy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoweringOptionsTest {

    @Test
    void defaults_matchTheDocumentedBehaviour() {
        LoweringOptions options = LoweringOptions.defaults();

        assertThat(options.getNamePrefix()).isEqualTo("__");
        assertThat(options.getHoistingStrategy()).isEqualTo(HoistingStrategy.POSITIONAL);
        assertThat(options.getJoinStrategy()).isEqualTo(JoinStrategy.COMPLETION_SIGNAL);
        assertThat(options.getGeneratorMarkers()).containsExactly("org.dynamis.async.runtime.Async.yieldValue");
    }

    @Test
    void fromProperties_readsEveryKey() {
        Properties properties = new Properties();
        properties.setProperty(LoweringOptions.PREFIX_PROPERTY, " gen_ ");
        properties.setProperty(LoweringOptions.HOISTING_PROPERTY, "dataflow");
        properties.setProperty(LoweringOptions.JOIN_STRATEGY_PROPERTY, "next_tick");
        properties.setProperty(LoweringOptions.GENERATOR_MARKERS_PROPERTY, "a.B.yield, c.D.emit ,");

        LoweringOptions options = LoweringOptions.fromProperties(properties);

        assertThat(options.getNamePrefix()).isEqualTo("gen_");
        assertThat(options.getHoistingStrategy()).isEqualTo(HoistingStrategy.DATAFLOW);
        assertThat(options.getJoinStrategy()).isEqualTo(JoinStrategy.NEXT_TICK);
        assertThat(options.getGeneratorMarkers()).containsExactlyInAnyOrder("a.B.yield", "c.D.emit");
    }

    @Test
    void fromProperties_keepsDefaultsForMissingKeys() {
        LoweringOptions options = LoweringOptions.fromProperties(new Properties());

        assertThat(options.toString()).isEqualTo(LoweringOptions.defaults().toString());
    }

    @Test
    void unknownEnumValue_namesTheKey() {
        Properties properties = new Properties();
        properties.setProperty(LoweringOptions.HOISTING_PROPERTY, "eager");

        assertThatThrownBy(() -> LoweringOptions.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(LoweringOptions.HOISTING_PROPERTY)
                .hasMessageContaining("POSITIONAL");
    }

    @Test
    void prefix_mustBeAnIdentifier() {
        assertThatThrownBy(() -> LoweringOptions.builder().namePrefix("1x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LoweringOptions.builder().namePrefix(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilder_copiesEverySetting() {
        LoweringOptions original = LoweringOptions.builder()
                .namePrefix("p_")
                .joinStrategy(JoinStrategy.NEXT_TICK)
                .build();

        LoweringOptions copy = original.toBuilder().hoistingStrategy(HoistingStrategy.DATAFLOW).build();

        assertThat(copy.getNamePrefix()).isEqualTo("p_");
        assertThat(copy.getJoinStrategy()).isEqualTo(JoinStrategy.NEXT_TICK);
        assertThat(copy.getHoistingStrategy()).isEqualTo(HoistingStrategy.DATAFLOW);
    }
}

package org.splc.compiler.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class CompilerConfigTest {

    @Test
    void defaultsComeFromReferenceConf() {
        // Act
        CompilerConfig config = CompilerConfig.defaults();

        // Assert
        assertThat(config.start()).isEqualTo(10);
        assertThat(config.step()).isEqualTo(10);
        assertThat(config.strictLabels()).isTrue();
        assertThat(config.freshParameterPrefix()).isEqualTo("P");
        assertThat(config.freshLocalPrefix()).isEqualTo("L");
    }

    @Test
    void resourceOverridesOnlyWhatItNames() {
        // Act
        CompilerConfig config = CompilerConfig.fromConfig(ConfigLoader.load("org/splc/compiler/config/test-compiler.conf"));

        // Assert
        assertThat(config.start()).isEqualTo(100);
        assertThat(config.step()).isEqualTo(5);
        assertThat(config.strictLabels()).isFalse();
        assertThat(config.freshParameterPrefix()).isEqualTo("P");
        assertThat(config.freshLocalPrefix()).isEqualTo("L");
    }

    @Test
    void readsInlinerPrefixes() {
        // Arrange
        var raw = ConfigFactory.parseString("splc.compiler.inliner { fresh-parameter-prefix = Arg, fresh-local-prefix = Tmp }")
                .withFallback(ConfigFactory.defaultReference());

        // Act
        CompilerConfig config = CompilerConfig.fromConfig(raw);

        // Assert
        assertThat(config.freshParameterPrefix()).isEqualTo("Arg");
        assertThat(config.freshLocalPrefix()).isEqualTo("Tmp");
    }

    @Test
    void rejectsNegativeStart() {
        assertThatThrownBy(() -> new CompilerConfig(-1, 10, true, "P", "L"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("splc.compiler.linearizer.start must be >= 0, got -1");
    }

    @Test
    void rejectsNonPositiveStep() {
        assertThatThrownBy(() -> CompilerConfig.defaults().withAddressing(0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("splc.compiler.linearizer.step must be > 0, got 0");
    }

    @Test
    void rejectsPrefixThatCouldCollideWithSourceNames() {
        assertThatThrownBy(() -> new CompilerConfig(10, 10, true, "p", "L"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fresh-parameter-prefix")
                .hasMessageEndingWith("got 'p'");
        assertThatThrownBy(() -> new CompilerConfig(10, 10, true, "P", "L1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fresh-local-prefix");
    }

    @Test
    void withAddressingKeepsTheOtherSettings() {
        CompilerConfig config = new CompilerConfig(10, 10, false, "Arg", "Tmp").withAddressing(0, 1);

        assertThat(config).isEqualTo(new CompilerConfig(0, 1, false, "Arg", "Tmp"));
    }
}

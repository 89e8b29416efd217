package org.kal.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for reading {@link CompilerSettings} from configuration.
 */
@Tag("unit")
class CompilerSettingsTest {

    private static Config withReference(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    @Test
    void referenceConfigurationMatchesDefaults() {
        CompilerSettings settings = CompilerSettings.fromConfig(withReference(""));
        CompilerSettings defaults = CompilerSettings.defaults();

        assertThat(settings.moduleName()).isEqualTo(defaults.moduleName());
        assertThat(settings.anonymousFunctionName()).isEqualTo(defaults.anonymousFunctionName());
        assertThat(settings.operators().asMap()).isEqualTo(defaults.operators().asMap());
        assertThat(settings.prompt()).isEqualTo("ready> ");
        assertThat(settings.evaluate()).isTrue();
        assertThat(settings.dumpModuleOnExit()).isTrue();
        assertThat(settings.maxCallDepth()).isEqualTo(defaults.maxCallDepth());
    }

    @Test
    void operatorTableCanBeExtendedAndMadeRightAssociative() {
        CompilerSettings settings = CompilerSettings.fromConfig(withReference("""
                kal.operators { "^" = 50, "<" = 0 }
                kal.right-associative = ["^"]
                """));

        assertThat(settings.operators().precedenceOf('^')).isEqualTo(50);
        assertThat(settings.operators().isRightAssociative('^')).isTrue();
        assertThat(settings.operators().isOperator('<')).isFalse();
        assertThat(settings.operators().precedenceOf('*')).isEqualTo(40);
    }

    @Test
    void multiCharacterOperatorIsRejected() {
        Config config = withReference("kal.operators { \"**\" = 60 }");

        assertThatThrownBy(() -> CompilerSettings.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("single character");
    }

    @Test
    void nonNumericPrecedenceIsRejected() {
        Config config = withReference("kal.operators { \"%\" = high }");

        assertThatThrownBy(() -> CompilerSettings.fromConfig(config))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void copiesReplaceSingleFlags() {
        CompilerSettings settings = CompilerSettings.defaults().withEvaluate(false).withDumpModuleOnExit(false);

        assertThat(settings.evaluate()).isFalse();
        assertThat(settings.dumpModuleOnExit()).isFalse();
        assertThat(settings.moduleName()).isEqualTo("my cool jit");
    }
}

package org.braceform.engine.passes;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PassOptionsTest {

    @Test
    void referenceConfigMatchesTheDefaults() {
        Config config = ConfigFactory.defaultReference();

        assertThat(PassOptions.fromConfig(config)).isEqualTo(PassOptions.defaults());
    }

    @Test
    void readsOverridesFromTheBraceformSection() {
        Config config = ConfigFactory.parseString("""
                braceform {
                  passes.virtual-braces = false
                  passes.semicolon-scope = ALL_STATEMENTS
                  passes.squeeze-ifdef-top-level = true
                  output.emit-virtual-semicolons = true
                }
                """);

        PassOptions options = PassOptions.fromConfig(config);

        assertThat(options.virtualBraces()).isFalse();
        assertThat(options.semicolonScope()).isEqualTo(SemicolonScope.ALL_STATEMENTS);
        assertThat(options.squeezeIfdefTopLevel()).isTrue();
        assertThat(options.emitVirtualSemicolons()).isTrue();
        assertThat(options.virtualSemicolons()).isTrue();
        assertThat(options.normalizeConditionals()).isTrue();
    }

    @Test
    void acceptsTheSectionItself() {
        Config section = ConfigFactory.parseString("passes.normalize-conditionals = false");

        assertThat(PassOptions.fromConfig(section).normalizeConditionals()).isFalse();
    }

    @Test
    void rejectsUnknownScope() {
        Config config = ConfigFactory.parseString("braceform.passes.semicolon-scope = SOMETIMES");

        assertThatThrownBy(() -> PassOptions.fromConfig(config)).isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void rejectsMissingScope() {
        assertThatThrownBy(() -> new PassOptions(true, true, null, true, true, true, false, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withersReplaceOneField() {
        PassOptions options = PassOptions.defaults()
                .withEmitVirtualSemicolons(true)
                .withSemicolonScope(SemicolonScope.ALL_STATEMENTS);

        assertThat(options.emitVirtualSemicolons()).isTrue();
        assertThat(options.semicolonScope()).isEqualTo(SemicolonScope.ALL_STATEMENTS);
        assertThat(options.squeezeIfdef()).isEqualTo(PassOptions.defaults().squeezeIfdef());
    }
}

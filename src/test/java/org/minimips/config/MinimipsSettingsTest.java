package org.minimips.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.minimips.compiler.ProgramLoader;
import org.minimips.runtime.Config;
import org.minimips.runtime.model.MachineStatus;
import org.minimips.runtime.session.DebugSession;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MinimipsSettingsTest {

    @Test
    void defaultsMatchMachineConstants() {
        MinimipsSettings settings = MinimipsSettings.defaults();

        assertThat(settings.eagerValidation()).isFalse();
        assertThat(settings.maxSteps()).isEqualTo(Config.MAX_STEPS);
        assertThat(settings.historyLimit()).isEqualTo(Config.DEFAULT_HISTORY_LIMIT);
    }

    @Test
    void readsOverriddenValues() {
        MinimipsSettings settings = MinimipsSettings.from(ConfigFactory.parseString(
                "minimips { loader.eager-validation = true, runtime.max-steps = 5, session.history-limit = 0 }"));

        assertThat(settings.newLoader().isEagerValidation()).isTrue();
        assertThat(settings.newVirtualMachine().getMaxSteps()).isEqualTo(5);
    }

    @Test
    void createdSessionUsesTheSettings() {
        MinimipsSettings settings = new MinimipsSettings(false, 2, 0);
        DebugSession session = settings.newSession();

        session.load("loop: j loop\n");
        assertThat(session.run().getStatus()).isEqualTo(MachineStatus.ERROR);
        assertThat(session.canStepBack()).isFalse();
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new MinimipsSettings(false, 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-steps");
        assertThatThrownBy(() -> new MinimipsSettings(false, 10, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("history-limit");
        assertThatThrownBy(() -> MinimipsSettings.from(ConfigFactory.parseString("minimips.runtime.max-steps = lots")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void newLoaderHonorsEagerValidation() {
        ProgramLoader loader = new MinimipsSettings(true, 10, 0).newLoader();

        assertThat(loader.isEagerValidation()).isTrue();
    }
}

package de.mirkosertic.rundownmonitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RundownMonitorApplication command line")
class RundownMonitorApplicationTest {

    @Test
    @DisplayName("Should run continuously with the default config file when no arguments are given")
    void shouldUseDefaults() {
        final RundownMonitorApplication.CommandLine commandLine = RundownMonitorApplication.CommandLine.parse(new String[0]);

        assertThat(commandLine.once()).isFalse();
        assertThat(commandLine.configFile()).isNull();
    }

    @Test
    @DisplayName("Should accept --once and --config in any order")
    void shouldParseFlags() {
        assertThat(RundownMonitorApplication.CommandLine.parse(new String[]{"--config", "prod.yaml", "--once"}))
                .isEqualTo(new RundownMonitorApplication.CommandLine(true, Paths.get("prod.yaml")));
        assertThat(RundownMonitorApplication.CommandLine.parse(new String[]{"--once", "--config=other.yaml"}))
                .isEqualTo(new RundownMonitorApplication.CommandLine(true, Paths.get("other.yaml")));
    }

    @Test
    @DisplayName("Should reject unknown arguments and a dangling --config")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> RundownMonitorApplication.CommandLine.parse(new String[]{"--verbose"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--verbose");
        assertThatThrownBy(() -> RundownMonitorApplication.CommandLine.parse(new String[]{"--config"}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.pizhai.render.chrome;

import com.pizhai.render.exception.RenderException.LaunchFailureException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChromeLauncherTest {

    @Test
    public void headlessCommandCarriesContainerFlags() {
        List<String> command = new ChromeLauncher().buildCommand("/usr/bin/chromium", 9300, true);

        assertThat(command.get(0)).isEqualTo("/usr/bin/chromium");
        assertThat(command).contains("--headless", "--no-sandbox", "--disable-dev-shm-usage",
                "--remote-allow-origins=*", "--remote-debugging-port=9300");
        assertThat(command).doesNotContain("--single-process");
        assertThat(command.get(command.size() - 1)).isEqualTo("about:blank");
    }

    @Test
    public void headfulCommandOmitsHeadlessFlag() {
        List<String> command = new ChromeLauncher().buildCommand("chrome", 0, false);

        assertThat(command).doesNotContain("--headless");
        assertThat(command).contains("--remote-debugging-port=0");
    }

    @Test
    public void missingExecutableFailsLaunch() {
        ChromeLauncher launcher = new ChromeLauncher();

        assertThatThrownBy(() -> launcher.launch("/nonexistent/chrome-binary", 0, true, 2000))
                .isInstanceOf(LaunchFailureException.class)
                .hasMessageContaining("启动Chrome失败");
        assertThat(launcher.isAlive()).isFalse();
        assertThat(launcher.getWebSocketDebuggerUrl()).isNull();
    }

    @Test
    public void closeWithoutLaunchIsHarmless() {
        ChromeLauncher launcher = new ChromeLauncher();

        launcher.close();
        launcher.close();

        assertThat(launcher.isAlive()).isFalse();
    }
}

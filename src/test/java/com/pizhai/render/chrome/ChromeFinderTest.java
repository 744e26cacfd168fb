package com.pizhai.render.chrome;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class ChromeFinderTest {

    @TempDir
    Path tempDir;

    @Test
    public void candidatePathsFollowOperatingSystem() {
        assertThat(ChromeFinder.candidatePaths("windows 11")).allMatch(p -> p.endsWith("chrome.exe"));
        assertThat(ChromeFinder.candidatePaths("mac os x")).anyMatch(p -> p.startsWith("/Applications/"));
        assertThat(ChromeFinder.candidatePaths("linux")).contains("/usr/bin/google-chrome", "/snap/bin/chromium");
        assertThat(ChromeFinder.candidatePaths("plan9")).isEmpty();
    }

    @Test
    public void onlyExecutableFilesQualify() throws IOException {
        File script = Files.createFile(tempDir.resolve("chrome")).toFile();
        assertThat(ChromeFinder.isExecutable(script.getPath())).isEqualTo(script.canExecute());

        assertThat(script.setExecutable(true)).isTrue();
        assertThat(ChromeFinder.isExecutable(script.getPath())).isTrue();

        assertThat(ChromeFinder.isExecutable(tempDir.toString())).isFalse();
        assertThat(ChromeFinder.isExecutable(tempDir.resolve("missing").toString())).isFalse();
    }
}

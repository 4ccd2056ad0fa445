package io.skipkp.cli;

import io.skipkp.TestConfigs;
import io.skipkp.config.KeyProviderConfig;
import io.skipkp.config.KeyProviderConfigLoader;
import io.skipkp.runtime.KeyProviderRuntime;
import io.skipkp.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KeyProviderCommandTest {

    @Test
    void checkConfigAcceptsValidSettings() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-cli-");
        try {
            TestConfigs.standalone(root);
            int code = execute("--config", configFile(root).toString(), "check-config");
            assertEquals(0, code);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void checkConfigReportsEveryErrorWithExitCodeTwo() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-cli-");
        try {
            Map<String, Object> settings = TestConfigs.baseSettings(root, "KP_A");
            settings.put("remoteSystemIds", List.of());
            settings.put("peers", List.of(TestConfigs.peer("KP_B", 9002, "too-short")));
            Files.writeString(configFile(root), Jsons.toJson(settings), StandardCharsets.UTF_8);

            int code = execute("--config", configFile(root).toString(), "check-config");
            assertEquals(2, code);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healthAndAuditVerifyRunAgainstAnExistingDataDir() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-cli-");
        try {
            KeyProviderConfig config = TestConfigs.standalone(root);
            try (KeyProviderRuntime runtime = new KeyProviderRuntime(config)) {
                runtime.init();
                runtime.keyStore().generate("KP_QuIIN_Client", 256).close();
            }
            String file = configFile(root).toString();
            assertEquals(0, execute("--config", file, "health"));
            assertEquals(0, execute("--config", file, "audit-verify"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void syncOnceWithoutPeersSucceeds() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-cli-");
        try {
            TestConfigs.standalone(root);
            assertEquals(0, execute("--config", configFile(root).toString(), "sync-once", "--sweep"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int execute(String... args) {
        return new CommandLine(new KeyProviderCommand()).execute(args);
    }

    private static Path configFile(Path root) {
        return root.resolve(KeyProviderConfigLoader.DEFAULT_FILE_NAME);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

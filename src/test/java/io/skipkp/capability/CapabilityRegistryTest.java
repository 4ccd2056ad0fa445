package io.skipkp.capability;

import com.fasterxml.jackson.databind.JsonNode;
import io.skipkp.TestConfigs;
import io.skipkp.config.KeyProviderConfig;
import io.skipkp.model.CapabilityDescriptor;
import io.skipkp.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class CapabilityRegistryTest {

    @Test
    void authorizesConfiguredIdsAndPatternsOnly() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-capability-");
        try {
            CapabilityRegistry registry = new CapabilityRegistry(TestConfigs.standalone(root));
            Assertions.assertTrue(registry.authorize("KP_QuIIN_Client"));
            Assertions.assertTrue(registry.authorize("KP_Lab_Test"));
            Assertions.assertTrue(registry.authorize("KP_Development_42"));
            Assertions.assertFalse(registry.authorize("KP_QuIIN_Client2"));
            Assertions.assertFalse(registry.authorize("Unknown"));
            Assertions.assertFalse(registry.authorize(""));
            Assertions.assertFalse(registry.authorize(null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void descriptorUsesProtocolFieldNames() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-capability-");
        try {
            Map<String, Object> settings = TestConfigs.baseSettings(root, "KP_Edge");
            settings.put("remoteSystemIds", List.of("KP_Only"));
            KeyProviderConfig config = TestConfigs.load(root, settings);
            CapabilityDescriptor descriptor = new CapabilityRegistry(config).describe();

            JsonNode json = Jsons.mapper().readTree(Jsons.toJson(descriptor));
            Assertions.assertTrue(json.path("entropy").asBoolean());
            Assertions.assertTrue(json.path("key").asBoolean());
            Assertions.assertEquals(KeyProviderConfig.DEFAULT_ALGORITHM, json.path("algorithm").asText());
            Assertions.assertEquals("KP_Edge", json.path("localSystemID").asText());
            Assertions.assertEquals("KP_Only", json.path("remoteSystemID").get(0).asText());
        } finally {
            deleteRecursively(root);
        }
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

package io.skipkp.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.skipkp.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksKeyMaterialAndSecretsButKeepsIdentifiers() {
        JsonNode input = Jsons.mapper().valueToTree(Map.of(
                "keyId", "0123456789abcdef0123456789abcdef",
                "key", "00112233",
                "sharedSecret", "short",
                "messageId", "4f0c6f1e-0000-4000-8000-000000000001",
                "nested", List.of(Map.of("payload", "abc"))
        ));
        JsonNode out = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("0123456789abcdef0123456789abcdef", out.path("keyId").asText());
        Assertions.assertEquals("4f0c6f1e-0000-4000-8000-000000000001", out.path("messageId").asText());
        Assertions.assertEquals("***", out.path("key").asText());
        Assertions.assertEquals("***", out.path("sharedSecret").asText());
        Assertions.assertEquals("***", out.path("nested").get(0).path("payload").asText());
    }

    @Test
    void longOpaqueValuesAreTreatedAsSecrets() {
        Assertions.assertTrue(SensitiveDataMasker.likelySecretValue("a".repeat(64)));
        Assertions.assertFalse(SensitiveDataMasker.likelySecretValue("0123456789abcdef0123456789abcdef"));
        Assertions.assertFalse(SensitiveDataMasker.likelySecretValue("peer KP_B unreachable after 3 attempts"));
    }
}

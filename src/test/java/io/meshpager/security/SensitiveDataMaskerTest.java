package io.meshpager.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshpager.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {
    @Test
    void masksCredentialFieldsOnly() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("mqtt_password", "large4cats");
        node.put("encryption_key", "1PG7OiApB1nwvP+rz05pAQ==");
        node.put("mqtt_username", "meshdev");
        node.put("dapnet_password", "");
        node.putObject("nested").put("api_token", "abc");

        JsonNode masked = SensitiveDataMasker.masked(node);

        Assertions.assertEquals("***", masked.path("mqtt_password").asText());
        Assertions.assertEquals("***", masked.path("encryption_key").asText());
        Assertions.assertEquals("meshdev", masked.path("mqtt_username").asText());
        Assertions.assertEquals("", masked.path("dapnet_password").asText());
        Assertions.assertEquals("***", masked.path("nested").path("api_token").asText());
    }
}

package com.sretoolbox.support;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.json.PackageVersion;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Map;
import org.junit.Test;

public class JsonTest {
    private final ObjectMapper mapper = Json.newMapper();

    @Test
    public void coreAndDatabindVersionsAgree() {
        assertThat(PackageVersion.VERSION.getMinorVersion(),
                is(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION.getMinorVersion()));
        assertThat(StreamReadConstraints.defaults().getMaxNestingDepth() > 0, is(true));
    }

    @Test
    public void treeConversionsWork() throws Exception {
        ObjectNode node = mapper.createObjectNode();
        node.put("sla_ms", 200);
        JsonNode tree = mapper.valueToTree(Map.of("at", Instant.parse("2024-05-01T10:00:00Z")));
        assertThat(tree.get("at").asText(), is("2024-05-01T10:00:00Z"));
        assertThat(mapper.treeToValue(node, Map.class).get("sla_ms"), is(200));
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedStoredJsonIsRejected() {
        Json.readTree(mapper, "{not json");
    }
}

package com.inspectvoice.sealing.canonical;

import com.inspectvoice.sealing.domain.ExportManifest;
import com.inspectvoice.sealing.domain.ExportType;
import com.inspectvoice.sealing.domain.GeneratedBy;
import com.inspectvoice.sealing.domain.ManifestFileEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalJsonTest {

    @Test
    void sortsKeysRegardlessOfInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", "x");
        first.put("c", true);

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("c", true);
        second.put("a", "x");
        second.put("b", 1);

        assertThat(CanonicalJson.canonicalString(first)).isEqualTo("{\"a\":\"x\",\"b\":1,\"c\":true}");
        assertThat(CanonicalJson.canonicalize(first)).isEqualTo(CanonicalJson.canonicalize(second));
    }

    @Test
    void sortsNestedObjectsAndKeepsArrayOrder() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("y", 2);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("list", List.of(3, 1, 2));
        root.put("inner", inner);

        assertThat(CanonicalJson.canonicalString(root))
                .isEqualTo("{\"inner\":{\"y\":2,\"z\":1},\"list\":[3,1,2]}");
    }

    @Test
    void writesNullsExplicitly() {
        Map<String, Object> value = new HashMap<>();
        value.put("prev", null);
        value.put("id", "b1");

        assertThat(CanonicalJson.canonicalString(value)).isEqualTo("{\"id\":\"b1\",\"prev\":null}");
    }

    @Test
    void manifestSerialisationIsStableAndCompact() {
        ExportManifest manifest = new ExportManifest(1, "b1", "2024-03-01T10:15:30.123Z",
                new GeneratedBy("u1", null), "t1", ExportType.PDF_REPORT, null, "HMAC-SHA256", "k1",
                "https://verify.test/api/v1/verify/b1", null,
                List.of(new ManifestFileEntry("report.pdf", "aa", 12, "application/pdf")));

        String json = CanonicalJson.canonicalString(manifest);

        assertThat(json).startsWith("{\"bundle_id\":\"b1\",\"export_type\":\"pdf_report\",\"files\":[");
        assertThat(json).contains("\"prev_bundle_hash\":null");
        assertThat(json).contains("\"source_id\":null");
        assertThat(json).contains("\"generated_by\":{\"display_name\":null,\"user_id\":\"u1\"}");
        assertThat(json).doesNotContain(" ").doesNotContain("\n");
        assertThat(CanonicalJson.canonicalize(manifest)).isEqualTo(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void encodesNonAsciiAsUtf8() {
        byte[] bytes = CanonicalJson.canonicalize(Map.of("name", "Zoë"));

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("{\"name\":\"Zoë\"}");
        assertThat(bytes).hasSize(15);
    }
}

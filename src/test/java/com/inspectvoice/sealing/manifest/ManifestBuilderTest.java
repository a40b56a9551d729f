package com.inspectvoice.sealing.manifest;

import com.inspectvoice.sealing.domain.ExportManifest;
import com.inspectvoice.sealing.domain.ExportType;
import com.inspectvoice.sealing.domain.GeneratedBy;
import com.inspectvoice.sealing.domain.ManifestFileEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestBuilderTest {

    private ManifestBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ManifestBuilder();
        builder.verifyBaseUrl = "https://verify.test/";
        builder.clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
    }

    @Test
    void buildsVersionOneManifestWithAllFields() {
        List<ManifestFileEntry> files = List.of(new ManifestFileEntry("report.pdf", "ab", 12, "application/pdf"));

        ExportManifest manifest = builder.build(ManifestBuilder.params()
                .bundleId("b1")
                .tenantId("t1")
                .exportType(ExportType.CLAIMS_PACK)
                .sourceId("src-1")
                .generatedBy(new GeneratedBy("u1", "Una"))
                .signingKeyId("k1")
                .prevBundleHash("ff")
                .files(files));

        assertThat(manifest.getVersion()).isEqualTo(ExportManifest.CURRENT_VERSION);
        assertThat(manifest.getBundleId()).isEqualTo("b1");
        assertThat(manifest.getTenantId()).isEqualTo("t1");
        assertThat(manifest.getExportType()).isEqualTo(ExportType.CLAIMS_PACK);
        assertThat(manifest.getSourceId()).isEqualTo("src-1");
        assertThat(manifest.getSignatureAlgorithm()).isEqualTo("HMAC-SHA256");
        assertThat(manifest.getSigningKeyId()).isEqualTo("k1");
        assertThat(manifest.getPrevBundleHash()).isEqualTo("ff");
        assertThat(manifest.getFiles()).isEqualTo(files);
        assertThat(manifest.getGeneratedAt()).isEqualTo("2024-03-01T10:15:30.000Z");
        assertThat(manifest.getVerifyUrl()).isEqualTo("https://verify.test/api/v1/verify/b1");
    }

    @Test
    void genesisManifestHasNullPredecessor() {
        ExportManifest manifest = builder.build(ManifestBuilder.params()
                .bundleId("b1").tenantId("t1").exportType(ExportType.PDF_REPORT).signingKeyId("k1")
                .files(List.of(new ManifestFileEntry("a.pdf", "ab", 1, "application/pdf"))));

        assertThat(manifest.getPrevBundleHash()).isNull();
        assertThat(manifest.getSourceId()).isNull();
    }

    @Test
    void rejectsEmptyFileList() {
        assertThatThrownBy(() -> builder.build(ManifestBuilder.params()
                .bundleId("b1").tenantId("t1").exportType(ExportType.PDF_REPORT).signingKeyId("k1")
                .files(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verifyUrlHandlesBaseWithoutTrailingSlash() {
        builder.verifyBaseUrl = "https://app.example.com";

        assertThat(builder.verifyUrl("abc")).isEqualTo("https://app.example.com/api/v1/verify/abc");
    }
}

package com.inspectvoice.sealing.manifest;

import com.inspectvoice.sealing.crypto.ManifestSigner;
import com.inspectvoice.sealing.domain.ExportManifest;
import com.inspectvoice.sealing.domain.ExportType;
import com.inspectvoice.sealing.domain.GeneratedBy;
import com.inspectvoice.sealing.domain.ManifestFileEntry;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Assembles {@link ExportManifest} instances. No I/O; the only ambient input is the clock.
 */
@ApplicationScoped
public class ManifestBuilder {

    static final DateTimeFormatter GENERATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    @ConfigProperty(name = "app.verify.base-url", defaultValue = "https://app.inspectvoice.co.uk")
    String verifyBaseUrl;

    Clock clock = Clock.systemUTC();

    public ExportManifest build(Params params) {
        Objects.requireNonNull(params.bundleId, "bundleId");
        Objects.requireNonNull(params.tenantId, "tenantId");
        Objects.requireNonNull(params.exportType, "exportType");
        Objects.requireNonNull(params.signingKeyId, "signingKeyId");
        if (params.files == null || params.files.isEmpty()) {
            throw new IllegalArgumentException("A manifest must declare at least one file");
        }

        return new ExportManifest(
                ExportManifest.CURRENT_VERSION,
                params.bundleId,
                GENERATED_AT_FORMAT.format(clock.instant()),
                params.generatedBy,
                params.tenantId,
                params.exportType,
                params.sourceId,
                ManifestSigner.SIGNATURE_ALGORITHM,
                params.signingKeyId,
                verifyUrl(params.bundleId),
                params.prevBundleHash,
                params.files);
    }

    public String verifyUrl(String bundleId) {
        String base = verifyBaseUrl.endsWith("/")
                ? verifyBaseUrl.substring(0, verifyBaseUrl.length() - 1)
                : verifyBaseUrl;
        return base + "/api/v1/verify/" + bundleId;
    }

    public static Params params() {
        return new Params();
    }

    public static final class Params {
        private String bundleId;
        private String tenantId;
        private ExportType exportType;
        private String sourceId;
        private GeneratedBy generatedBy;
        private String signingKeyId;
        private String prevBundleHash;
        private List<ManifestFileEntry> files;

        private Params() {
        }

        public Params bundleId(String bundleId) {
            this.bundleId = bundleId;
            return this;
        }

        public Params tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Params exportType(ExportType exportType) {
            this.exportType = exportType;
            return this;
        }

        public Params sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Params generatedBy(GeneratedBy generatedBy) {
            this.generatedBy = generatedBy;
            return this;
        }

        public Params signingKeyId(String signingKeyId) {
            this.signingKeyId = signingKeyId;
            return this;
        }

        /** {@code null} for the first bundle of a tenant. */
        public Params prevBundleHash(String prevBundleHash) {
            this.prevBundleHash = prevBundleHash;
            return this;
        }

        public Params files(List<ManifestFileEntry> files) {
            this.files = files;
            return this;
        }
    }
}

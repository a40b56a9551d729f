package com.inspectvoice.sealing.seal;

import com.inspectvoice.sealing.archive.BundleArchiver;
import com.inspectvoice.sealing.canonical.CanonicalJson;
import com.inspectvoice.sealing.crypto.ContentHasher;
import com.inspectvoice.sealing.crypto.ManifestSigner;
import com.inspectvoice.sealing.crypto.SigningKey;
import com.inspectvoice.sealing.domain.ExportManifest;
import com.inspectvoice.sealing.domain.ManifestFileEntry;
import com.inspectvoice.sealing.domain.SealedBundle;
import com.inspectvoice.sealing.manifest.ManifestBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Packages one bundle: manifest, canonical bytes, digest, signature and zip.
 * Touches neither storage nor the ledger, so a discarded result leaves no trace.
 */
@ApplicationScoped
public class BundleSealer {

    @Inject
    ManifestBuilder manifestBuilder;

    public SealedBundle seal(String bundleId,
                             SealRequest request,
                             List<ManifestFileEntry> fileEntries,
                             String prevBundleHash,
                             SigningKey signingKey) {
        ExportManifest manifest = manifestBuilder.build(ManifestBuilder.params()
                .bundleId(bundleId)
                .tenantId(request.getTenantId())
                .exportType(request.getExportType())
                .sourceId(request.getSourceId())
                .generatedBy(request.getGeneratedBy())
                .signingKeyId(signingKey.getKeyId())
                .prevBundleHash(prevBundleHash)
                .files(fileEntries));

        byte[] manifestBytes = CanonicalJson.canonicalize(manifest);
        String manifestSha256 = ContentHasher.sha256Hex(manifestBytes);
        String signature = ManifestSigner.sign(manifestBytes, signingKey);
        byte[] archive = BundleArchiver.buildArchive(request.getFiles(), manifestBytes, signature);

        return new SealedBundle(bundleId, archive, manifest,
                new String(manifestBytes, StandardCharsets.UTF_8), manifestSha256, signature);
    }
}

package com.inspectvoice.sealing.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inspectvoice.sealing.archive.BundleArchive;
import com.inspectvoice.sealing.archive.BundleArchiveReader;
import com.inspectvoice.sealing.archive.BundlePaths;
import com.inspectvoice.sealing.archive.MalformedArchiveException;
import com.inspectvoice.sealing.crypto.ContentHasher;
import com.inspectvoice.sealing.crypto.ManifestSigner;
import com.inspectvoice.sealing.crypto.SigningKey;
import com.inspectvoice.sealing.crypto.SigningKeyResolver;
import com.inspectvoice.sealing.domain.ExportManifest;
import com.inspectvoice.sealing.domain.ManifestFileEntry;
import com.inspectvoice.sealing.domain.SealedExportRow;
import com.inspectvoice.sealing.ledger.ChainLedgerFacade;
import com.inspectvoice.sealing.ledger.LedgerException;
import com.inspectvoice.sealing.storage.BundleStorageFacade;
import com.inspectvoice.sealing.util.AlertLogger;
import com.inspectvoice.sealing.util.SealingMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Independently checks a sealed bundle.
 * <p>
 * Checks run in a fixed order and the first failure wins:
 * archive structure, manifest, signing key and signature, file contents, then the
 * ledger. The signature is checked before any file so that an unauthenticated file
 * list is never trusted. The ledger step only runs when the ledger is reachable and
 * holds a row for the bundle.
 */
@ApplicationScoped
public class BundleVerifier {

    private static final Logger LOG = Logger.getLogger(BundleVerifier.class);

    @Inject
    SigningKeyResolver signingKeyResolver;

    @Inject
    ChainLedgerFacade chainLedger;

    @Inject
    BundleStorageFacade bundleStorage;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    SealingMetrics sealingMetrics;

    /**
     * Verifies an archive supplied by a caller, e.g. a downloaded bundle.
     */
    public VerificationResult verify(byte[] archiveBytes) {
        return record(verifyArchive(archiveBytes, null));
    }

    /**
     * Verifies the stored archive of a recorded bundle.
     *
     * @throws LedgerException  if the ledger cannot be read
     * @throws com.inspectvoice.sealing.storage.StorageException if storage cannot be read
     */
    public VerificationResult verifyStored(String bundleId) {
        Optional<SealedExportRow> row = chainLedger.findByBundleId(bundleId);
        if (row.isEmpty()) {
            return record(VerificationResult.failure(VerificationReason.BUNDLE_NOT_FOUND,
                    "no ledger row for bundle " + bundleId));
        }
        Optional<byte[]> archive = bundleStorage.get(row.get().getStorageKey());
        if (archive.isEmpty()) {
            LOG.errorf("Ledger row for bundle %s points at missing object %s", bundleId, row.get().getStorageKey());
            return record(VerificationResult.failure(VerificationReason.BUNDLE_NOT_FOUND,
                    "archive missing from storage for bundle " + bundleId));
        }
        return record(verifyArchive(archive.get(), row.get()));
    }

    private VerificationResult record(VerificationResult result) {
        sealingMetrics.recordVerification(result.getReason().getCode());
        if (result.getReason().indicatesTampering()) {
            AlertLogger.tamperDetected(result.getBundleId(), result.getReason().getCode(), result.getDetail());
        } else if (!result.isValid()) {
            LOG.infof("Bundle did not verify: %s (%s)", result.getReason(), result.getDetail());
        }
        return result;
    }

    private VerificationResult verifyArchive(byte[] archiveBytes, SealedExportRow knownRow) {
        BundleArchive archive;
        try {
            archive = BundleArchiveReader.read(archiveBytes);
        } catch (MalformedArchiveException e) {
            return VerificationResult.failure(VerificationReason.MALFORMED_ARCHIVE, e.getMessage());
        }

        byte[] manifestBytes = archive.manifestBytes();
        ExportManifest manifest;
        try {
            manifest = objectMapper.readValue(manifestBytes, ExportManifest.class);
        } catch (IOException e) {
            return VerificationResult.failure(VerificationReason.MALFORMED_MANIFEST,
                    "manifest.json does not parse: " + e.getMessage());
        }
        String structuralProblem = structuralProblem(manifest);
        if (structuralProblem != null) {
            return VerificationResult.failure(VerificationReason.MALFORMED_MANIFEST, structuralProblem);
        }
        String manifestSha256 = ContentHasher.sha256Hex(manifestBytes);

        Optional<SigningKey> key = signingKeyResolver.resolve(manifest.getSigningKeyId());
        if (key.isEmpty()) {
            return VerificationResult.failure(VerificationReason.UNKNOWN_KEY,
                    "signing key " + manifest.getSigningKeyId() + " is not known",
                    manifest, manifestSha256, false);
        }
        if (!ManifestSigner.verify(manifestBytes, archive.signature(), key.get())) {
            return VerificationResult.failure(VerificationReason.SIGNATURE_INVALID,
                    "manifest signature does not match", manifest, manifestSha256, false);
        }

        VerificationResult fileFailure = checkFiles(archive, manifest, manifestSha256);
        if (fileFailure != null) {
            return fileFailure;
        }

        return checkChain(manifest, manifestSha256, knownRow);
    }

    private static String structuralProblem(ExportManifest manifest) {
        if (manifest == null) {
            return "manifest.json is not a JSON object";
        }
        if (manifest.getVersion() != ExportManifest.CURRENT_VERSION) {
            return "unsupported manifest version " + manifest.getVersion();
        }
        if (manifest.getBundleId() == null || manifest.getTenantId() == null
                || manifest.getSigningKeyId() == null || manifest.getExportType() == null) {
            return "manifest is missing required fields";
        }
        if (manifest.getFiles().isEmpty()) {
            return "manifest declares no files";
        }
        for (ManifestFileEntry entry : manifest.getFiles()) {
            if (entry == null || entry.getPath() == null || entry.getSha256() == null) {
                return "manifest file entry is incomplete";
            }
        }
        return null;
    }

    private static VerificationResult checkFiles(BundleArchive archive, ExportManifest manifest, String manifestSha256) {
        Set<String> declared = new HashSet<>();
        for (ManifestFileEntry entry : manifest.getFiles()) {
            declared.add(entry.getPath());
            Optional<byte[]> data = archive.entry(entry.getPath());
            if (data.isEmpty()) {
                return VerificationResult.failure(VerificationReason.FILE_MISSING,
                        entry.getPath() + " is declared but not in the archive", manifest, manifestSha256, false);
            }
            byte[] bytes = data.get();
            if (bytes.length != entry.getBytes() || !ContentHasher.sha256Hex(bytes).equals(entry.getSha256())) {
                return VerificationResult.failure(VerificationReason.FILE_HASH_MISMATCH,
                        entry.getPath() + " does not match its declared digest", manifest, manifestSha256, false);
            }
        }
        for (String path : archive.paths()) {
            if (!declared.contains(path) && !BundlePaths.isReserved(path)) {
                return VerificationResult.failure(VerificationReason.UNDECLARED_FILE,
                        path + " is in the archive but not in the manifest", manifest, manifestSha256, false);
            }
        }
        return null;
    }

    private VerificationResult checkChain(ExportManifest manifest, String manifestSha256, SealedExportRow knownRow) {
        try {
            if (knownRow == null && !chainLedger.isAvailable()) {
                LOG.warnf("Ledger unavailable; chain check skipped for bundle %s", manifest.getBundleId());
                return VerificationResult.valid(manifest, manifestSha256, false);
            }
            Optional<SealedExportRow> row = knownRow != null
                    ? Optional.of(knownRow)
                    : chainLedger.findByBundleId(manifest.getBundleId());
            if (row.isEmpty()) {
                return VerificationResult.valid(manifest, manifestSha256, false);
            }

            String mismatch = chainMismatch(manifest, manifestSha256, row.get());
            if (mismatch != null) {
                return VerificationResult.failure(VerificationReason.CHAIN_MISMATCH, mismatch,
                        manifest, manifestSha256, true);
            }
            return VerificationResult.valid(manifest, manifestSha256, true);
        } catch (LedgerException e) {
            LOG.warnf(e, "Ledger error during chain check of bundle %s; reporting without chain check",
                    manifest.getBundleId());
            return VerificationResult.valid(manifest, manifestSha256, false);
        }
    }

    private String chainMismatch(ExportManifest manifest, String manifestSha256, SealedExportRow row) {
        if (!Objects.equals(row.getBundleId(), manifest.getBundleId())) {
            return "archive carries bundle " + manifest.getBundleId() + " but ledger row is " + row.getBundleId();
        }
        if (!Objects.equals(row.getTenantId(), manifest.getTenantId())) {
            return "tenant differs from ledger";
        }
        if (!Objects.equals(row.getManifestSha256(), manifestSha256)) {
            return "manifest digest differs from ledger";
        }
        if (!Objects.equals(row.getPrevBundleHash(), manifest.getPrevBundleHash())) {
            return "prev_bundle_hash differs from ledger";
        }

        Optional<SealedExportRow> predecessor = chainLedger.findPredecessor(row);
        if (manifest.getPrevBundleHash() == null) {
            if (predecessor.isPresent()) {
                return "genesis manifest recorded after bundle " + predecessor.get().getBundleId();
            }
            return null;
        }
        if (predecessor.isEmpty()) {
            return "predecessor of bundle " + manifest.getBundleId() + " is not recorded";
        }
        if (!manifest.getPrevBundleHash().equals(predecessor.get().getManifestSha256())) {
            return "prev_bundle_hash does not match predecessor " + predecessor.get().getBundleId();
        }
        return null;
    }
}

package com.inspectvoice.sealing.archive;

import com.inspectvoice.sealing.domain.BundleFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes the zip container: source files at their declared paths, then
 * {@code manifest.json} and {@code manifest.sig} at the root.
 */
public final class BundleArchiver {

    static final int COMPRESSION_LEVEL = 6;

    private BundleArchiver() {
    }

    /**
     * @param files          source files, already hashed into the manifest
     * @param manifestBytes  canonical manifest bytes, stored verbatim
     * @param signature      base64 signature over {@code manifestBytes}
     * @return the archive bytes
     */
    public static byte[] buildArchive(List<BundleFile> files, byte[] manifestBytes, String signature) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(estimateSize(files, manifestBytes));
        try (ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
            zip.setLevel(COMPRESSION_LEVEL);
            for (BundleFile file : files) {
                writeEntry(zip, file.getPath(), file.getData());
            }
            writeEntry(zip, BundlePaths.MANIFEST_ENTRY, manifestBytes);
            writeEntry(zip, BundlePaths.SIGNATURE_ENTRY, signature.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build bundle archive", e);
        }
        return out.toByteArray();
    }

    private static void writeEntry(ZipOutputStream zip, String path, byte[] data) throws IOException {
        zip.putNextEntry(new ZipEntry(path));
        zip.write(data);
        zip.closeEntry();
    }

    private static int estimateSize(List<BundleFile> files, byte[] manifestBytes) {
        long total = manifestBytes.length + 512L;
        for (BundleFile file : files) {
            total += file.getLength();
        }
        return (int) Math.min(total, Integer.MAX_VALUE - 8);
    }
}

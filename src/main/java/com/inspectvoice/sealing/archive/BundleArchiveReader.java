package com.inspectvoice.sealing.archive;

import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

/**
 * Reads an untrusted bundle archive into memory.
 * <p>
 * Guards against zip bombs and traversal: bounded entry count, bounded total
 * uncompressed size, no absolute or {@code ..} paths, no duplicate names.
 * <p>
 * The archive must be a single zip spanning the whole byte range: it starts with a
 * local file header, ends with the end of central directory record, and the central
 * directory closes exactly where that record begins. Entries are read twice, once
 * through the central directory (what unzip tools show) and once through the local
 * headers (what streaming readers show), and both views must hold the same names in
 * the same order with identical content.
 */
public final class BundleArchiveReader {

    private static final Logger LOG = Logger.getLogger(BundleArchiveReader.class);

    static final int MAX_ENTRIES = 10_000;
    static final long MAX_UNCOMPRESSED_TOTAL = 512L * 1024 * 1024;

    static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;
    static final int END_RECORD_SIGNATURE = 0x06054b50;
    static final int END_RECORD_SIZE = 22;
    private static final int MAX_COMMENT_LENGTH = 0xFFFF;

    private BundleArchiveReader() {
    }

    /**
     * @throws MalformedArchiveException if the bytes are not a safe archive containing
     *                                   both {@code manifest.json} and {@code manifest.sig}
     */
    public static BundleArchive read(byte[] archiveBytes) {
        if (archiveBytes == null || archiveBytes.length == 0) {
            throw new MalformedArchiveException("empty archive");
        }
        requireSingleArchive(archiveBytes);

        Map<String, byte[]> central = readCentralDirectory(archiveBytes);
        Map<String, byte[]> local = readLocalHeaders(archiveBytes);
        requireSameEntries(central, local);

        if (central.isEmpty()) {
            throw new MalformedArchiveException("archive has no entries");
        }
        if (!central.containsKey(BundlePaths.MANIFEST_ENTRY)) {
            throw new MalformedArchiveException("archive has no " + BundlePaths.MANIFEST_ENTRY);
        }
        if (!central.containsKey(BundlePaths.SIGNATURE_ENTRY)) {
            throw new MalformedArchiveException("archive has no " + BundlePaths.SIGNATURE_ENTRY);
        }
        return new BundleArchive(central);
    }

    static void requireSingleArchive(byte[] bytes) {
        if (bytes.length < END_RECORD_SIZE + 4 || le32(bytes, 0) != LOCAL_HEADER_SIGNATURE) {
            throw new MalformedArchiveException("not a zip archive: no local file header at offset 0");
        }
        int end = findEndRecord(bytes);
        if (end < 0) {
            throw new MalformedArchiveException("no end of central directory record at the end of the archive");
        }

        int disk = le16(bytes, end + 4);
        int centralDisk = le16(bytes, end + 6);
        int entriesOnDisk = le16(bytes, end + 8);
        int totalEntries = le16(bytes, end + 10);
        long centralSize = le32(bytes, end + 12) & 0xFFFFFFFFL;
        long centralOffset = le32(bytes, end + 16) & 0xFFFFFFFFL;

        if (disk != 0 || centralDisk != 0 || entriesOnDisk != totalEntries) {
            throw new MalformedArchiveException("multi-disk archives are not supported");
        }
        if (totalEntries == 0xFFFF || centralSize == 0xFFFFFFFFL || centralOffset == 0xFFFFFFFFL) {
            throw new MalformedArchiveException("zip64 archives are not supported");
        }
        if (centralOffset + centralSize != end) {
            throw new MalformedArchiveException("central directory does not end at the end record: offset "
                    + centralOffset + " + size " + centralSize + " != " + end);
        }
    }

    /** Offset of the end record whose comment runs exactly to the last byte, or -1. */
    private static int findEndRecord(byte[] bytes) {
        int lowest = Math.max(0, bytes.length - END_RECORD_SIZE - MAX_COMMENT_LENGTH);
        for (int pos = bytes.length - END_RECORD_SIZE; pos >= lowest; pos--) {
            if (le32(bytes, pos) == END_RECORD_SIGNATURE
                    && pos + END_RECORD_SIZE + le16(bytes, pos + 20) == bytes.length) {
                return pos;
            }
        }
        return -1;
    }

    private static Map<String, byte[]> readCentralDirectory(byte[] archiveBytes) {
        Path spool = spool(archiveBytes);
        try (ZipFile zip = new ZipFile(spool.toFile(), StandardCharsets.UTF_8)) {
            EntryCollector collector = new EntryCollector();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                byte[] data;
                try (InputStream in = zip.getInputStream(entry)) {
                    data = collector.add(entry.getName(), in);
                }
                CRC32 crc = new CRC32();
                crc.update(data);
                if (entry.getCrc() != -1 && crc.getValue() != entry.getCrc()) {
                    throw new MalformedArchiveException("crc mismatch for " + entry.getName());
                }
            }
            return collector.entries;
        } catch (IOException e) {
            throw new MalformedArchiveException("not a readable zip archive: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // ZipFile reports undecodable entry names this way
            throw new MalformedArchiveException("malformed entry name: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(spool);
            } catch (IOException e) {
                LOG.warnf(e, "Failed to delete spooled archive %s", spool);
            }
        }
    }

    private static Map<String, byte[]> readLocalHeaders(byte[] archiveBytes) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archiveBytes), StandardCharsets.UTF_8)) {
            EntryCollector collector = new EntryCollector();
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                collector.add(entry.getName(), zip);
            }
            return collector.entries;
        } catch (IOException e) {
            throw new MalformedArchiveException("not a readable zip archive: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedArchiveException("malformed entry name: " + e.getMessage(), e);
        }
    }

    private static void requireSameEntries(Map<String, byte[]> central, Map<String, byte[]> local) {
        if (!new ArrayList<>(central.keySet()).equals(new ArrayList<>(local.keySet()))) {
            throw new MalformedArchiveException("local headers " + local.keySet()
                    + " do not match central directory " + central.keySet());
        }
        for (Map.Entry<String, byte[]> entry : central.entrySet()) {
            if (!Arrays.equals(entry.getValue(), local.get(entry.getKey()))) {
                throw new MalformedArchiveException("entry " + entry.getKey()
                        + " differs between local header and central directory");
            }
        }
    }

    private static Path spool(byte[] archiveBytes) {
        try {
            Path spool = Files.createTempFile("bundle-", ".zip");
            Files.write(spool, archiveBytes);
            return spool;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to spool archive for reading", e);
        }
    }

    private static int le16(byte[] b, int off) {
        return (b[off] & 0xFF) | (b[off + 1] & 0xFF) << 8;
    }

    private static int le32(byte[] b, int off) {
        return le16(b, off) | le16(b, off + 2) << 16;
    }

    private static final class EntryCollector {

        private final Map<String, byte[]> entries = new LinkedHashMap<>();
        private final byte[] buf = new byte[8192];
        private long totalUncompressed;

        byte[] add(String name, InputStream in) throws IOException {
            if (entries.size() >= MAX_ENTRIES) {
                throw new MalformedArchiveException("too many entries: more than " + MAX_ENTRIES);
            }
            String path;
            try {
                path = BundlePaths.requireSafe(name);
            } catch (IllegalArgumentException e) {
                throw new MalformedArchiveException("unsafe entry name: " + e.getMessage(), e);
            }
            if (entries.containsKey(path)) {
                throw new MalformedArchiveException("duplicate entry: " + path);
            }

            ByteArrayOutputStream data = new ByteArrayOutputStream();
            int n;
            while ((n = in.read(buf)) != -1) {
                totalUncompressed += n;
                if (totalUncompressed > MAX_UNCOMPRESSED_TOTAL) {
                    throw new MalformedArchiveException("uncompressed size exceeds " + MAX_UNCOMPRESSED_TOTAL + " bytes");
                }
                data.write(buf, 0, n);
            }
            byte[] bytes = data.toByteArray();
            entries.put(path, bytes);
            return bytes;
        }
    }
}

package com.inspectvoice.sealing.archive;

import com.inspectvoice.sealing.domain.BundleFile;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BundleArchiverTest {

    private static final byte[] MANIFEST = "{\"version\":1}".getBytes(StandardCharsets.UTF_8);

    @Test
    void writesFilesThenManifestThenSignature() throws IOException {
        byte[] zip = BundleArchiver.buildArchive(List.of(
                new BundleFile("report.pdf", "pdf".getBytes(StandardCharsets.UTF_8), "application/pdf"),
                new BundleFile("data/defects.csv", "a,b".getBytes(StandardCharsets.UTF_8), "text/csv")),
                MANIFEST, "c2ln");

        assertThat(entryNames(zip)).containsExactly("report.pdf", "data/defects.csv", "manifest.json", "manifest.sig");
    }

    @Test
    void archiveReadsBackToSameContent() {
        byte[] pdf = "%PDF-1.4 abc".getBytes(StandardCharsets.UTF_8);
        byte[] zip = BundleArchiver.buildArchive(
                List.of(new BundleFile("report.pdf", pdf, "application/pdf")), MANIFEST, "c2ln");

        BundleArchive archive = BundleArchiveReader.read(zip);

        assertThat(archive.size()).isEqualTo(3);
        assertThat(archive.entry("report.pdf").orElseThrow()).isEqualTo(pdf);
        assertThat(archive.manifestBytes()).isEqualTo(MANIFEST);
        assertThat(archive.signature()).isEqualTo("c2ln");
    }

    @Test
    void readerRejectsEmptyAndNonZipInput() {
        assertThatThrownBy(() -> BundleArchiveReader.read(new byte[0]))
                .isInstanceOf(MalformedArchiveException.class);
        assertThatThrownBy(() -> BundleArchiveReader.read("definitely not a zip".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedArchiveException.class);
    }

    @Test
    void readerRejectsArchiveWithoutManifestOrSignature() throws IOException {
        byte[] noSignature = zipOf("report.pdf", "x", "manifest.json", "{}");
        byte[] noManifest = zipOf("report.pdf", "x", "manifest.sig", "c2ln");

        assertThatThrownBy(() -> BundleArchiveReader.read(noSignature))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("manifest.sig");
        assertThatThrownBy(() -> BundleArchiveReader.read(noManifest))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("manifest.json");
    }

    @Test
    void readerRejectsTraversalAndAbsoluteEntryNames() throws IOException {
        byte[] traversal = zipOf("../evil.sh", "x", "manifest.json", "{}", "manifest.sig", "c2ln");
        byte[] absolute = zipOf("/etc/cron.d/evil", "x", "manifest.json", "{}", "manifest.sig", "c2ln");

        assertThatThrownBy(() -> BundleArchiveReader.read(traversal))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("unsafe entry name");
        assertThatThrownBy(() -> BundleArchiveReader.read(absolute))
                .isInstanceOf(MalformedArchiveException.class);
    }

    @Test
    void readerSkipsDirectoryEntries() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry("photos/"));
            zip.closeEntry();
            put(zip, "photos/a.jpg", "jpg");
            put(zip, "manifest.json", "{}");
            put(zip, "manifest.sig", "c2ln");
        }

        assertThat(BundleArchiveReader.read(out.toByteArray()).paths())
                .containsExactly("photos/a.jpg", "manifest.json", "manifest.sig");
    }

    @Test
    void readerRejectsBytesBeforeOrAfterTheArchive() throws IOException {
        byte[] zip = BundleArchiver.buildArchive(
                List.of(new BundleFile("report.pdf", "pdf".getBytes(StandardCharsets.UTF_8), "application/pdf")),
                MANIFEST, "c2ln");

        assertThatThrownBy(() -> BundleArchiveReader.read(concat("junk".getBytes(StandardCharsets.UTF_8), zip)))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("local file header");
        assertThatThrownBy(() -> BundleArchiveReader.read(concat(zip, "junk".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("end of central directory");
    }

    @Test
    void readerRejectsSecondArchiveAppendedToFirst() throws IOException {
        byte[] genuine = zipOf("report.pdf", "%PDF-1.4 abc", "manifest.json", "{}", "manifest.sig", "c2ln");
        byte[] forged = zipOf("report.pdf", "%PDF-1.4 FORGED", "manifest.json", "{}", "manifest.sig", "c2ln");

        assertThatThrownBy(() -> BundleArchiveReader.read(concat(genuine, forged)))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("central directory does not end at the end record");
    }

    @Test
    void readerRejectsAppendedArchiveWithRebasedOffsets() throws IOException {
        byte[] genuine = zipOf("report.pdf", "%PDF-1.4 abc", "manifest.json", "{}", "manifest.sig", "c2ln");
        byte[] forged = rebase(
                zipOf("report.pdf", "%PDF-1.4 FORGED", "manifest.json", "{}", "manifest.sig", "c2ln"),
                genuine.length);

        assertThatThrownBy(() -> BundleArchiveReader.read(concat(genuine, forged)))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("report.pdf differs between local header and central directory");
    }

    @Test
    void readerRejectsCentralDirectoryNameDifferentFromLocalHeader() throws IOException {
        byte[] zip = zipOf("report.pdf", "x", "manifest.json", "{}", "manifest.sig", "c2ln");
        byte[] name = "report.pdf".getBytes(StandardCharsets.UTF_8);
        int centralName = lastIndexOf(zip, name);
        System.arraycopy("rep0rt.pdf".getBytes(StandardCharsets.UTF_8), 0, zip, centralName, name.length);

        assertThatThrownBy(() -> BundleArchiveReader.read(zip))
                .isInstanceOf(MalformedArchiveException.class)
                .hasMessageContaining("do not match central directory");
    }

    static byte[] zipOf(String... nameAndContent) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (int i = 0; i < nameAndContent.length; i += 2) {
                put(zip, nameAndContent[i], nameAndContent[i + 1]);
            }
        }
        return out.toByteArray();
    }

    private static void put(ZipOutputStream zip, String name, String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] out = new byte[first.length + second.length];
        System.arraycopy(first, 0, out, 0, first.length);
        System.arraycopy(second, 0, out, first.length, second.length);
        return out;
    }

    /** Shifts every central directory offset of a standalone zip so it reads correctly after {@code shift} bytes. */
    private static byte[] rebase(byte[] zip, int shift) {
        byte[] out = zip.clone();
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        int end = out.length - BundleArchiveReader.END_RECORD_SIZE;
        int centralOffset = buf.getInt(end + 16);
        int entries = buf.getShort(end + 10) & 0xFFFF;
        int pos = centralOffset;
        for (int i = 0; i < entries; i++) {
            buf.putInt(pos + 42, buf.getInt(pos + 42) + shift);
            pos += 46 + (buf.getShort(pos + 28) & 0xFFFF) + (buf.getShort(pos + 30) & 0xFFFF)
                    + (buf.getShort(pos + 32) & 0xFFFF);
        }
        buf.putInt(end + 16, centralOffset + shift);
        return out;
    }

    private static int lastIndexOf(byte[] haystack, byte[] needle) {
        for (int i = haystack.length - needle.length; i >= 0; i--) {
            boolean match = true;
            for (int j = 0; j < needle.length && match; j++) {
                match = haystack[i + j] == needle[j];
            }
            if (match) {
                return i;
            }
        }
        throw new AssertionError("not found");
    }

    private static List<String> entryNames(byte[] zipBytes) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(zipBytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}

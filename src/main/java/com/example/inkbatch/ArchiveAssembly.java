package com.example.inkbatch;

import com.example.inkbatch.error.ArchiveException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Per-archive result buffer. Member results are stored by entry position as they complete,
 * in any order; the output archive is written in the original entry order once every image
 * member has reached a terminal state.
 */
public final class ArchiveAssembly implements Closeable {
    private final Path source;
    private final Path output;
    private final ZipFile zip;
    private final List<ZipEntry> entries;
    private final boolean[] imageMember;
    private final String[] outputNames;
    private final byte[][] results;
    private final boolean[] failed;
    private int pending;
    private int failures;
    private boolean closed;

    private ArchiveAssembly(Path source, Path output, ZipFile zip, List<ZipEntry> entries, Predicate<String> isImage) {
        this.source = source;
        this.output = output;
        this.zip = zip;
        this.entries = entries;
        this.imageMember = new boolean[entries.size()];
        this.outputNames = new String[entries.size()];
        this.results = new byte[entries.size()][];
        this.failed = new boolean[entries.size()];
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            imageMember[i] = isImage.test(entries.get(i).getName());
            if (imageMember[i]) {
                pending++;
            } else {
                outputNames[i] = entries.get(i).getName();
                taken.add(outputNames[i]);
            }
        }
        for (int i = 0; i < entries.size(); i++) {
            if (imageMember[i]) {
                outputNames[i] = uniqueName(ImageCodec.outputName(entries.get(i).getName()), taken);
            }
        }
    }

    /**
     * Opens {@code source} and indexes its file entries in central-directory order.
     */
    public static ArchiveAssembly open(Path source, Path output, Predicate<String> isImage) throws ArchiveException {
        ZipFile zip;
        try {
            zip = new ZipFile(source.toFile());
        } catch (IOException ex) {
            throw new ArchiveException("Failed to open archive", source, ex);
        }
        try {
            List<ZipEntry> entries = new ArrayList<>();
            Enumeration<? extends ZipEntry> enumeration = zip.entries();
            while (enumeration.hasMoreElements()) {
                ZipEntry entry = enumeration.nextElement();
                if (!entry.isDirectory()) {
                    entries.add(entry);
                }
            }
            return new ArchiveAssembly(source, output, zip, Collections.unmodifiableList(entries), isImage);
        } catch (RuntimeException ex) {
            closeQuietly(zip, ex);
            throw new ArchiveException("Failed to read archive entries", source, ex);
        }
    }

    public List<WorkItem> members() {
        List<WorkItem> members = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (imageMember[i]) {
                members.add(WorkItem.archiveMember(source, i, entries.get(i).getName()));
            }
        }
        return members;
    }

    public byte[] readMember(int position) throws ArchiveException {
        ZipEntry entry = entries.get(position);
        try (InputStream input = zip.getInputStream(entry)) {
            return input.readAllBytes();
        } catch (IOException ex) {
            throw new ArchiveException("Failed to extract " + entry.getName(), source, ex);
        }
    }

    /**
     * Stores a member's encoded result. Returns true when this was the last outstanding member.
     */
    public synchronized boolean complete(int position, byte[] encoded) {
        results[position] = encoded;
        return markDone(position);
    }

    /**
     * Marks a member as permanently failed. Returns true when this was the last outstanding member.
     */
    public synchronized boolean fail(int position) {
        failed[position] = true;
        failures++;
        return markDone(position);
    }

    public synchronized boolean hasFailures() {
        return failures > 0;
    }

    public synchronized int successfulMembers() {
        int count = 0;
        for (int i = 0; i < entries.size(); i++) {
            if (imageMember[i] && results[i] != null) {
                count++;
            }
        }
        return count;
    }

    public int imageMemberCount() {
        int count = 0;
        for (boolean image : imageMember) {
            if (image) {
                count++;
            }
        }
        return count;
    }

    /**
     * Writes successful members and verbatim non-image entries in original order, skipping failed members.
     * Image members are renamed to the output image extension.
     */
    public synchronized void write(int compressionLevel) throws ArchiveException {
        try {
            Path parent = output.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, ".ink-", ".cbz.tmp");
            try {
                try (OutputStream file = Files.newOutputStream(temp);
                     ZipOutputStream zipOut = new ZipOutputStream(file)) {
                    zipOut.setLevel(compressionLevel);
                    for (int i = 0; i < entries.size(); i++) {
                        if (failed[i]) {
                            continue;
                        }
                        ZipEntry entry = entries.get(i);
                        zipOut.putNextEntry(new ZipEntry(outputNames[i]));
                        if (imageMember[i]) {
                            zipOut.write(results[i]);
                        } else {
                            try (InputStream input = zip.getInputStream(entry)) {
                                input.transferTo(zipOut);
                            }
                        }
                        zipOut.closeEntry();
                    }
                }
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new ArchiveException("Failed to create archive", output, ex);
        }
    }

    /**
     * Entry name used for {@code position} in the output archive.
     */
    public String outputName(int position) {
        return outputNames[position];
    }

    public Path source() {
        return source;
    }

    public Path output() {
        return output;
    }

    @Override
    public synchronized void close() throws IOException {
        if (!closed) {
            closed = true;
            zip.close();
        }
    }

    private boolean markDone(int position) {
        if (!imageMember[position]) {
            throw new IllegalArgumentException("Entry " + position + " of " + source + " is not an image member");
        }
        pending--;
        return pending == 0;
    }

    /**
     * Converted members whose names collide, such as {@code p1.jpg} and {@code p1.png}, get a numeric suffix.
     */
    private static String uniqueName(String candidate, Set<String> taken) {
        String name = candidate;
        int dot = candidate.lastIndexOf('.');
        for (int n = 1; !taken.add(name); n++) {
            name = candidate.substring(0, dot) + "_" + n + candidate.substring(dot);
        }
        return name;
    }

    private static void closeQuietly(ZipFile zip, Exception primary) {
        try {
            zip.close();
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}

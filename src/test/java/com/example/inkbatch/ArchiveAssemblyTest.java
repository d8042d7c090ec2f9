package com.example.inkbatch;

import com.example.inkbatch.error.ArchiveException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveAssemblyTest {
    @Test
    void completesOnlyWhenEveryImageMemberIsDone() throws Exception {
        Path dir = Files.createTempDirectory("assembly");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("cover.png", bytes("cover"));
        entries.put("info.xml", bytes("<ComicInfo/>"));
        entries.put("page.png", bytes("page"));
        Path source = TestImages.writeZip(dir.resolve("in.cbz"), entries);
        Path output = dir.resolve("out/in.cbz");

        try (ArchiveAssembly assembly = ArchiveAssembly.open(source, output, name -> name.endsWith(".png"))) {
            List<WorkItem> members = assembly.members();
            assertEquals(2, members.size());
            assertEquals(2, members.get(1).positionInArchive());
            assertArrayEquals(bytes("page"), assembly.readMember(2));

            assertFalse(assembly.complete(2, bytes("PAGE")));
            assertTrue(assembly.complete(0, bytes("COVER")));
            assertFalse(assembly.hasFailures());
            assembly.write(9);
        }

        assertEquals(List.of("cover.png", "info.xml", "page.png"), TestImages.zipEntryNames(output));
        assertArrayEquals(bytes("COVER"), TestImages.zipEntry(output, "cover.png"));
        assertArrayEquals(bytes("<ComicInfo/>"), TestImages.zipEntry(output, "info.xml"));
    }

    @Test
    void failedMembersCountTowardCompletion() throws Exception {
        Path dir = Files.createTempDirectory("assembly");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("a.jpg", bytes("a"));
        entries.put("b.jpg", bytes("b"));
        Path source = TestImages.writeZip(dir.resolve("in.zip"), entries);

        try (ArchiveAssembly assembly = ArchiveAssembly.open(source, dir.resolve("in.cbz"), name -> true)) {
            assertFalse(assembly.fail(0));
            assertTrue(assembly.complete(1, bytes("B")));
            assertTrue(assembly.hasFailures());
            assertEquals(1, assembly.successfulMembers());
            assembly.write(1);
        }

        assertEquals(List.of("b.png"), TestImages.zipEntryNames(dir.resolve("in.cbz")));
    }

    @Test
    void collidingOutputNamesGetASuffix() throws Exception {
        Path dir = Files.createTempDirectory("assembly");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("cover.jpg", bytes("jpg"));
        entries.put("cover.gif", bytes("gif"));
        entries.put("cover.png", bytes("kept as is"));
        Path source = TestImages.writeZip(dir.resolve("in.cbz"), entries);
        Path output = dir.resolve("out.cbz");

        try (ArchiveAssembly assembly = ArchiveAssembly.open(source, output, name -> !name.endsWith(".png"))) {
            assertEquals("cover_1.png", assembly.outputName(0));
            assertEquals("cover_2.png", assembly.outputName(1));
            assertEquals("cover.png", assembly.outputName(2));
            assembly.complete(0, bytes("A"));
            assembly.complete(1, bytes("B"));
            assembly.write(6);
        }

        assertEquals(List.of("cover_1.png", "cover_2.png", "cover.png"), TestImages.zipEntryNames(output));
        assertArrayEquals(bytes("kept as is"), TestImages.zipEntry(output, "cover.png"));
    }

    @Test
    void unreadableArchiveFailsToOpen() throws Exception {
        Path dir = Files.createTempDirectory("assembly");
        Path bogus = Files.writeString(dir.resolve("bogus.cbz"), "plain text");

        ArchiveException ex = assertThrows(ArchiveException.class,
                () -> ArchiveAssembly.open(bogus, dir.resolve("out.cbz"), name -> true));
        assertEquals(bogus, ex.archive());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}

package com.example.inkbatch;

import java.nio.file.Path;

/**
 * One unit of batch work: a loose image file, or one image member of an archive.
 *
 * @param archiveId         source path of the owning archive, {@code null} for loose images
 * @param positionInArchive zero-based entry index inside the archive, {@code null} for loose images
 * @param entryName         zip entry name, {@code null} for loose images
 */
public record WorkItem(
        Path sourcePath,
        Kind kind,
        String archiveId,
        Integer positionInArchive,
        String entryName
) {
    public enum Kind {
        LOOSE_IMAGE,
        ARCHIVE_MEMBER
    }

    public static WorkItem looseImage(Path path) {
        return new WorkItem(path, Kind.LOOSE_IMAGE, null, null, null);
    }

    public static WorkItem archiveMember(Path archive, int position, String entryName) {
        return new WorkItem(archive, Kind.ARCHIVE_MEMBER, archive.toString(), position, entryName);
    }

    /**
     * Path used in progress events and error records; archive members read {@code archive!/entry}.
     */
    public String displayPath() {
        return kind == Kind.LOOSE_IMAGE ? sourcePath.toString() : sourcePath + "!/" + entryName;
    }
}

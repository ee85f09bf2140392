package com.tyron.nanodata.core.archive;

import com.tyron.nanodata.api.pointer.ArchiveConstructException;
import com.tyron.nanodata.api.pointer.ArchiveEntryNotFoundException;
import com.tyron.nanodata.testFramework.BaseResourceTest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

public class OpenOnDemandArchiveTest extends BaseResourceTest {

    private Path archivePath;

    @Override
    protected void beforeEach() throws Exception {
        archivePath = zip("data/pkg.zip",
                "pkg/",
                "pkg/a.txt", "alpha",
                "pkg/sub/b.txt", "beta!");
    }

    @Test
    public void indexesTheCentralDirectoryWithoutStayingOpen() throws Exception {
        OpenOnDemandArchive archive = new OpenOnDemandArchive(archivePath);

        Assertions.assertFalse(archive.isOpen());
        Assertions.assertEquals(1, archive.getOpenCount());
        Assertions.assertEquals(List.of("pkg/", "pkg/a.txt", "pkg/sub/b.txt"), List.copyOf(archive.getEntryNames()));
        Assertions.assertEquals(5, archive.getSize("pkg/sub/b.txt"));
    }

    @Test
    public void everyReadReopensAndCloses() throws Exception {
        OpenOnDemandArchive archive = new OpenOnDemandArchive(archivePath);

        Assertions.assertEquals("alpha", new String(archive.read("pkg/a.txt"), StandardCharsets.UTF_8));
        Assertions.assertFalse(archive.isOpen());
        Assertions.assertEquals("beta!", new String(archive.read("pkg/sub/b.txt"), StandardCharsets.UTF_8));
        Assertions.assertFalse(archive.isOpen());

        Assertions.assertEquals(3, archive.getOpenCount());
    }

    @Test
    public void failedReadsAlsoClose() throws Exception {
        OpenOnDemandArchive archive = new OpenOnDemandArchive(archivePath);

        ArchiveEntryNotFoundException e = Assertions.assertThrows(ArchiveEntryNotFoundException.class,
                () -> archive.read("pkg/missing.txt"));
        Assertions.assertEquals("pkg/missing.txt", e.getEntry());
        Assertions.assertFalse(archive.isOpen());

        Assertions.assertThrows(ArchiveEntryNotFoundException.class, () -> archive.read("pkg/"));
        Assertions.assertFalse(archive.isOpen());

        // both failures opened a fresh handle and closed it again
        Assertions.assertEquals(3, archive.getOpenCount());
        Assertions.assertEquals("alpha", new String(archive.read("pkg/a.txt"), StandardCharsets.UTF_8));
        Assertions.assertFalse(archive.isOpen());
    }

    @Test
    public void prefixQueries() throws Exception {
        OpenOnDemandArchive archive = new OpenOnDemandArchive(archivePath);

        Assertions.assertTrue(archive.contains("pkg/a.txt"));
        Assertions.assertFalse(archive.contains("pkg/sub/"));
        Assertions.assertTrue(archive.hasEntryWithPrefix("pkg/sub/"));
        Assertions.assertFalse(archive.hasEntryWithPrefix("other/"));
        Assertions.assertThrows(ArchiveEntryNotFoundException.class, () -> archive.getSize("nope"));
    }

    @Test
    public void invalidArchiveFailsFast() throws Exception {
        Path notAZip = file("data/broken.zip", "this is not a zip file");
        Assertions.assertThrows(ArchiveConstructException.class, () -> new OpenOnDemandArchive(notAZip));
        Assertions.assertThrows(ArchiveConstructException.class,
                () -> new OpenOnDemandArchive(temporaryFolder.resolve("missing.zip")));
    }
}

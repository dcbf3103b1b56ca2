package org.janelia.mediasync.dataservice.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.mediasync.model.MediaKind;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MediaFileScannerTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private final MediaFileScanner mediaFileScanner = new MediaFileScanner();

    @Test
    public void classifyByExtension() {
        assertTrue(mediaFileScanner.isSupportedImage("IMG_0001.JPG"));
        assertTrue(mediaFileScanner.isSupportedImage("scan.tif"));
        assertTrue(mediaFileScanner.isSupportedImage("live.heic"));
        assertTrue(mediaFileScanner.isSupportedVideo("clip.MOV"));
        assertTrue(mediaFileScanner.isSupportedVideo("old.3gp"));
        assertFalse(mediaFileScanner.isSupportedMediaFile("notes.txt"));
        assertFalse(mediaFileScanner.isSupportedMediaFile("README"));
        assertFalse(mediaFileScanner.isSupportedMediaFile(null));
        assertEquals(MediaKind.VIDEO, mediaFileScanner.getMediaKind("clip.mkv"));
        assertEquals(MediaKind.PHOTO, mediaFileScanner.getMediaKind("a.png"));
    }

    @Test
    public void contentTypes() {
        assertEquals("image/jpeg", mediaFileScanner.getContentType("a.jpeg"));
        assertEquals("video/quicktime", mediaFileScanner.getContentType("a.MOV"));
        assertEquals("application/octet-stream", mediaFileScanner.getContentType("a.xyz"));
    }

    @Test
    public void uniqueFilenameWithoutCollision() throws IOException {
        Path dir = testFolder.newFolder().toPath();
        assertEquals("holiday.jpg", mediaFileScanner.generateUniqueFilename("holiday.jpg", dir));
    }

    @Test
    public void uniqueFilenameOnCollision() throws IOException {
        Path dir = testFolder.newFolder().toPath();
        Files.createFile(dir.resolve("holiday.jpg"));
        String uniqueName = mediaFileScanner.generateUniqueFilename("holiday.jpg", dir);
        assertThat(uniqueName, matchesPattern("holiday_\\d{8}_\\d{6}_001\\.jpg"));
        Files.createFile(dir.resolve(uniqueName));
        assertThat(mediaFileScanner.generateUniqueFilename("holiday.jpg", dir), not(uniqueName));
    }

    @Test
    public void unsafeCharactersAreReplaced() throws IOException {
        Path dir = testFolder.newFolder().toPath();
        String uniqueName = mediaFileScanner.generateUniqueFilename("my:photo*?.png", dir);
        assertThat(uniqueName, endsWith(".png"));
        assertThat(uniqueName, startsWith("my_photo"));
        assertEquals("photo.jpg", mediaFileScanner.generateUniqueFilename("...jpg", dir));
    }
}

package com.phillippitts.holderbot.service.photo;

import com.phillippitts.holderbot.config.properties.PhotoProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryPhotoSourceTest {

    @TempDir
    Path dir;

    private static void writePng(Path file, int w, int h) throws IOException {
        ImageIO.write(new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB), "png", file.toFile());
    }

    @Test
    void findsPhotographByIdAndExtension() throws IOException {
        writePng(dir.resolve("42.png"), 30, 20);
        DirectoryPhotoSource source = new DirectoryPhotoSource(new PhotoProperties(dir.toString(), List.of("jpg", "png")));

        Photograph photo = source.find("42").orElseThrow();

        assertThat(photo.subjectId()).isEqualTo("42");
        assertThat(photo.width()).isEqualTo(30);
        assertThat(photo.height()).isEqualTo(20);
    }

    @Test
    void missingOrUnreadableFilesYieldNothing() throws IOException {
        Files.writeString(dir.resolve("7.png"), "not an image");
        DirectoryPhotoSource source = new DirectoryPhotoSource(new PhotoProperties(dir.toString(), List.of("png")));

        assertThat(source.find("7")).isEmpty();
        assertThat(source.find("8")).isEmpty();
    }

    @Test
    void rejectsIdsThatEscapeTheDirectory() throws IOException {
        writePng(dir.resolve("secret.png"), 5, 5);
        Path nested = Files.createDirectory(dir.resolve("photos"));
        DirectoryPhotoSource source = new DirectoryPhotoSource(new PhotoProperties(nested.toString(), List.of("png")));

        assertThat(source.find("../secret")).isEmpty();
        assertThat(source.find(".hidden")).isEmpty();
    }

    @Test
    void unconfiguredDirectoryFindsNothing() {
        assertThat(new DirectoryPhotoSource(new PhotoProperties("", null)).find("1")).isEmpty();
    }
}

package com.phillippitts.holderbot.service.photo;

import com.phillippitts.holderbot.config.properties.PhotoProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads {@code {directory}/{subjectId}.{extension}} for the configured extensions, first
 * match wins. Without a configured directory no photograph is ever found.
 */
@Component
public class DirectoryPhotoSource implements PhotoSource {

    private static final Logger LOG = LogManager.getLogger(DirectoryPhotoSource.class);

    // ids become file names; anything that could escape the directory is rejected
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final Path directory;
    private final List<String> extensions;

    public DirectoryPhotoSource(PhotoProperties properties) {
        this.directory = properties.getDirectory().isEmpty() ? null : Paths.get(properties.getDirectory());
        this.extensions = properties.getExtensions();
        if (directory == null) {
            LOG.info("holderbot.photos.directory not set; decisions run without photographs");
        }
    }

    @Override
    public Optional<Photograph> find(String subjectId) {
        if (directory == null || subjectId == null || !SAFE_ID.matcher(subjectId).matches()
                || subjectId.startsWith(".")) {
            return Optional.empty();
        }
        if (!Files.isDirectory(directory)) {
            LOG.debug("Photo directory missing: {}", directory);
            return Optional.empty();
        }
        for (String ext : extensions) {
            Path file = directory.resolve(subjectId + "." + ext);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                BufferedImage image = ImageIO.read(file.toFile());
                if (image == null) {
                    LOG.warn("Unsupported image format: {}", file.getFileName());
                    continue;
                }
                return Optional.of(new Photograph(subjectId, image));
            } catch (IOException e) {
                LOG.warn("Unreadable photograph {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}

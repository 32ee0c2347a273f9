package com.phillippitts.holderbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;

/**
 * Where the directory photo source looks for {@code {subjectId}.{extension}} files.
 */
@ConfigurationProperties(prefix = "holderbot.photos")
public class PhotoProperties {

    private final String directory;
    private final List<String> extensions;

    @ConstructorBinding
    public PhotoProperties(String directory, List<String> extensions) {
        this.directory = directory == null ? "" : directory.trim();
        this.extensions = extensions == null || extensions.isEmpty()
                ? List.of("png", "jpg", "jpeg")
                : List.copyOf(extensions);
    }

    public String getDirectory() {
        return directory;
    }

    public List<String> getExtensions() {
        return extensions;
    }
}

package com.phillippitts.holderbot.service.photo;

import java.util.Optional;

/**
 * Supplies the photograph of a subject, if one exists. Acquisition and caching are the
 * implementation's business; a missing or unreadable photograph is simply empty.
 */
public interface PhotoSource {

    Optional<Photograph> find(String subjectId);
}

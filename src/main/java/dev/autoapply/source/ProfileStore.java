package dev.autoapply.source;

import dev.autoapply.model.ApplicationPayload.ProfileSnapshot;
import dev.autoapply.model.ApplicationPayload.ResumeSnapshot;
import dev.autoapply.model.ApplicationPayload.UserSnapshot;

import java.util.Optional;

/**
 * Read access to the user, resume and profile data a submission is built from.
 */
public interface ProfileStore {

    Optional<UserSnapshot> findUser(Long userId);

    Optional<ResumeSnapshot> findResume(Long userId);

    Optional<ProfileSnapshot> findProfile(Long userId);
}

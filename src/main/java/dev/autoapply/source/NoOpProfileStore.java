package dev.autoapply.source;

import dev.autoapply.model.ApplicationPayload.ProfileSnapshot;
import dev.autoapply.model.ApplicationPayload.ResumeSnapshot;
import dev.autoapply.model.ApplicationPayload.UserSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Profile store used when no user data backend is wired in.
 * Links processed against it are skipped.
 */
@Slf4j
@Component
public class NoOpProfileStore implements ProfileStore {

    public NoOpProfileStore() {
        log.info("No profile backend configured - using no-op profile store");
    }

    @Override
    public Optional<UserSnapshot> findUser(Long userId) {
        return Optional.empty();
    }

    @Override
    public Optional<ResumeSnapshot> findResume(Long userId) {
        return Optional.empty();
    }

    @Override
    public Optional<ProfileSnapshot> findProfile(Long userId) {
        return Optional.empty();
    }
}

package com.nosota.bounty.service;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Profile;
import com.nosota.bounty.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final ProfileRepository profileRepository;
    private final DeletionCascadeService deletionCascadeService;

    /**
     * Creates the profile for an identity-provider user. Registering an existing user returns the stored profile.
     */
    @Transactional
    public Profile register(UUID userId, String displayName) {
        return profileRepository.findById(userId).orElseGet(() -> {
            Profile profile = new Profile(userId, displayName, LocalDateTime.now());
            profileRepository.save(profile);
            log.info("Account registered: userId={}", userId);
            return profile;
        });
    }

    /**
     * Deletes an account through the deletion cascade.
     *
     * @throws BountyLifecycleException NOT_AUTHORIZED unless the caller owns the account or is an admin
     */
    @Transactional
    public DeletionReport deleteAccount(CallerIdentity caller, UUID userId) {
        if (!caller.admin() && !caller.userId().equals(userId)) {
            throw new BountyLifecycleException(LifecycleErrorKind.NOT_AUTHORIZED,
                    String.format("Caller may not delete account: callerId=%s, userId=%s", caller.userId(), userId));
        }
        return deletionCascadeService.deleteUser(userId);
    }
}

package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.Rating;
import com.nosota.bounty.repository.RatingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Post-completion ratings between poster and hunter, one per direction per bounty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingService {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private final RatingRepository ratingRepository;
    private final BountyLifecycleService bountyLifecycleService;

    @Transactional
    public Rating rate(CallerIdentity caller, UUID bountyId, int rating, String comment) {
        Bounty bounty = bountyLifecycleService.lockBounty(bountyId);
        if (bounty.getStatus() != BountyStatus.COMPLETED) {
            throw new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_COMPLETED,
                    String.format("Bounty not completed: bountyId=%s, status=%s", bountyId, bounty.getStatus()));
        }

        UUID target;
        if (CallerGuards.isPoster(bounty, caller)) {
            target = bounty.getAcceptedHunterId();
        } else if (CallerGuards.isAcceptedHunter(bounty, caller)) {
            target = bounty.getPosterId();
        } else {
            throw new BountyLifecycleException(LifecycleErrorKind.NOT_AUTHORIZED,
                    String.format("Caller did not take part: bountyId=%s, callerId=%s", bountyId, caller.userId()));
        }

        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new BountyLifecycleException(LifecycleErrorKind.INVALID_RATING, "Rating out of range: " + rating);
        }
        if (ratingRepository.existsByBountyIdAndFromUserId(bountyId, caller.userId())) {
            throw new BountyLifecycleException(LifecycleErrorKind.RATING_ALREADY_SUBMITTED,
                    String.format("Already rated: bountyId=%s, fromUserId=%s", bountyId, caller.userId()));
        }

        Rating entity = new Rating();
        entity.setBountyId(bountyId);
        entity.setFromUserId(caller.userId());
        entity.setToUserId(target);
        entity.setRating(rating);
        entity.setComment(comment);
        entity.setCreatedAt(LocalDateTime.now());
        ratingRepository.save(entity);

        log.info("Rating submitted: bountyId={}, fromUserId={}, toUserId={}, rating={}",
                bountyId, caller.userId(), target, rating);
        return entity;
    }

    @Transactional(readOnly = true)
    public List<Rating> listForBounty(UUID bountyId) {
        return ratingRepository.findByBountyIdOrderByCreatedAtAsc(bountyId);
    }
}

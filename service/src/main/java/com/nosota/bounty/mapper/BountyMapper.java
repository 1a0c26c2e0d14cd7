package com.nosota.bounty.mapper;

import com.nosota.bounty.api.response.AccountResponse;
import com.nosota.bounty.api.response.BountyRequestResponse;
import com.nosota.bounty.api.response.BountyResponse;
import com.nosota.bounty.api.response.CancellationResponse;
import com.nosota.bounty.api.response.DeletionReportResponse;
import com.nosota.bounty.api.response.DisputeResponse;
import com.nosota.bounty.api.response.RatingResponse;
import com.nosota.bounty.api.response.SubmissionResponse;
import com.nosota.bounty.api.response.WalletTransactionResponse;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.BountyCancellation;
import com.nosota.bounty.model.BountyRequest;
import com.nosota.bounty.model.CompletionSubmission;
import com.nosota.bounty.model.Dispute;
import com.nosota.bounty.model.Profile;
import com.nosota.bounty.model.Rating;
import com.nosota.bounty.model.WalletTransaction;
import com.nosota.bounty.service.DeletionReport;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from entities to API responses.
 */
@Mapper
public interface BountyMapper {

    BountyMapper INSTANCE = Mappers.getMapper(BountyMapper.class);

    /**
     * Written by hand: the entity exposes {@code isForHonor()} as property {@code forHonor},
     * while the response component is named {@code isForHonor}.
     */
    default BountyResponse toResponse(Bounty bounty) {
        if (bounty == null) {
            return null;
        }
        return new BountyResponse(
                bounty.getId(),
                bounty.getPosterId(),
                bounty.getTitle(),
                bounty.getDescription(),
                bounty.getAmount(),
                bounty.isForHonor(),
                bounty.getWorkType(),
                bounty.getStatus(),
                bounty.getAcceptedHunterId(),
                bounty.getCreatedAt(),
                bounty.getUpdatedAt()
        );
    }

    BountyRequestResponse toResponse(BountyRequest request);

    List<BountyRequestResponse> toRequestResponses(List<BountyRequest> requests);

    SubmissionResponse toResponse(CompletionSubmission submission);

    List<SubmissionResponse> toSubmissionResponses(List<CompletionSubmission> submissions);

    DisputeResponse toResponse(Dispute dispute);

    CancellationResponse toResponse(BountyCancellation cancellation);

    List<CancellationResponse> toCancellationResponses(List<BountyCancellation> cancellations);

    RatingResponse toResponse(Rating rating);

    List<RatingResponse> toRatingResponses(List<Rating> ratings);

    WalletTransactionResponse toResponse(WalletTransaction transaction);

    List<WalletTransactionResponse> toTransactionResponses(List<WalletTransaction> transactions);

    @Mapping(target = "userId", source = "id")
    AccountResponse toResponse(Profile profile);

    DeletionReportResponse toResponse(DeletionReport report);
}

package com.nosota.bounty.api.model;

import org.springframework.http.HttpStatus;

/**
 * Closed set of failures the lifecycle engine reports.
 *
 * <p>Each kind carries the message shown to end users and the HTTP status the service answers with.
 * Clients switch on the kind, never on the message text.
 */
public enum LifecycleErrorKind {
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST,
            "The reward amount is invalid. Honor bounties must have a zero amount and paid bounties a non-negative amount with at most two decimals."),
    BOUNTY_NOT_FOUND(HttpStatus.NOT_FOUND,
            "This bounty does not exist or has been removed."),
    REQUEST_NOT_FOUND(HttpStatus.NOT_FOUND,
            "This application does not exist."),
    DISPUTE_NOT_FOUND(HttpStatus.NOT_FOUND,
            "This dispute does not exist."),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Register an account before using the marketplace."),
    BOUNTY_NOT_OPEN(HttpStatus.CONFLICT,
            "This bounty has already been accepted by another hunter or is no longer open."),
    REQUEST_NOT_PENDING(HttpStatus.CONFLICT,
            "This application has already been accepted or rejected."),
    SELF_APPLICATION(HttpStatus.UNPROCESSABLE_ENTITY,
            "You cannot apply to your own bounty."),
    DUPLICATE_APPLICATION(HttpStatus.CONFLICT,
            "You have already applied to this bounty."),
    NOT_ACCEPTED_HUNTER(HttpStatus.FORBIDDEN,
            "Only the hunter working on this bounty can do this."),
    NOT_BOUNTY_POSTER(HttpStatus.FORBIDDEN,
            "Only the poster of this bounty can do that."),
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN,
            "You are not allowed to perform this action."),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED,
            "Sign in to continue."),
    EMAIL_NOT_VERIFIED(HttpStatus.FORBIDDEN,
            "Verify your email address before posting, applying or approving work."),
    BOUNTY_NOT_IN_PROGRESS(HttpStatus.CONFLICT,
            "This bounty is not in progress."),
    SUBMISSION_ALREADY_PENDING(HttpStatus.CONFLICT,
            "A submission is already waiting for review."),
    NO_PENDING_SUBMISSION(HttpStatus.CONFLICT,
            "There is no submission waiting for review."),
    INVALID_FEEDBACK(HttpStatus.BAD_REQUEST,
            "Tell the hunter what needs to change before requesting a revision."),
    REVISION_LIMIT_REACHED(HttpStatus.CONFLICT,
            "The revision limit for this bounty has been reached. Open a dispute to resolve it."),
    INSUFFICIENT_BALANCE(HttpStatus.PAYMENT_REQUIRED,
            "Your wallet balance is too low. Add funds and try again."),
    PAYOUT_FAILED(HttpStatus.BAD_GATEWAY,
            "The payment could not be completed. Nothing was charged, please try again."),
    EXTERNAL_PAYMENT_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT,
            "The payment provider did not respond in time. Nothing was charged, please try again."),
    CANNOT_CANCEL_COMPLETED(HttpStatus.CONFLICT,
            "A completed bounty cannot be cancelled."),
    DISPUTE_OPEN(HttpStatus.CONFLICT,
            "This bounty is under dispute. Wait for the dispute to be resolved."),
    DISPUTE_ALREADY_OPEN(HttpStatus.CONFLICT,
            "A dispute is already open for this bounty."),
    DISPUTE_ALREADY_RESOLVED(HttpStatus.CONFLICT,
            "This dispute has already been resolved."),
    NOT_DISPUTE_PARTICIPANT(HttpStatus.FORBIDDEN,
            "Only the poster or the working hunter can dispute this bounty."),
    CANCELLATION_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Cancellation request not found."),
    CANCELLATION_ALREADY_PENDING(HttpStatus.CONFLICT,
            "A cancellation request is already waiting for the poster's answer."),
    CANCELLATION_NOT_PENDING(HttpStatus.CONFLICT,
            "This cancellation request has already been answered."),
    BOUNTY_NOT_COMPLETED(HttpStatus.CONFLICT,
            "Ratings can only be left on completed bounties."),
    INVALID_RATING(HttpStatus.BAD_REQUEST,
            "Ratings must be between 1 and 5."),
    RATING_ALREADY_SUBMITTED(HttpStatus.CONFLICT,
            "You have already rated this bounty.");

    private final HttpStatus httpStatus;
    private final String userMessage;

    LifecycleErrorKind(HttpStatus httpStatus, String userMessage) {
        this.httpStatus = httpStatus;
        this.userMessage = userMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getUserMessage() {
        return userMessage;
    }
}

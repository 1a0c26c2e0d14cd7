package com.nosota.bounty.custodian;

import com.nosota.bounty.config.BountyProperties;
import com.nosota.bounty.error.PaymentProcessorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Custodian backed by an external payment processor.
 *
 * <p>Each movement is {@code POST {base-url}/v1/custody/{hold|release|refund}} with the instruction as JSON
 * and an {@code Idempotency-Key} header, so a retried call after a rollback is recognized by the processor.
 * The call is bounded by {@code bounty.custodian.timeout}.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "bounty.custodian.mode", havingValue = "remote")
public class RemotePaymentCustodian implements PaymentCustodian {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WebClient webClient;
    private final Duration timeout;

    public RemotePaymentCustodian(WebClient.Builder webClientBuilder, BountyProperties properties) {
        this.webClient = webClientBuilder.baseUrl(properties.getCustodian().getBaseUrl()).build();
        this.timeout = properties.getCustodian().getTimeout();
    }

    @Override
    public void hold(CustodyInstruction instruction) {
        call("hold", instruction);
    }

    @Override
    public void release(CustodyInstruction instruction) {
        call("release", instruction);
    }

    @Override
    public void refund(CustodyInstruction instruction) {
        call("refund", instruction);
    }

    private void call(String operation, CustodyInstruction instruction) {
        log.debug("Calling custodian {}: key={}, amount={}", operation, instruction.idempotencyKey(), instruction.amount());

        try {
            webClient.post()
                    .uri("/v1/custody/{operation}", operation)
                    .header(IDEMPOTENCY_KEY_HEADER, instruction.idempotencyKey())
                    .bodyValue(instruction)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new PaymentProcessorException(
                    String.format("Custodian %s rejected: key=%s, status=%s", operation,
                            instruction.idempotencyKey(), e.getStatusCode()),
                    false, e);
        } catch (RuntimeException e) {
            boolean timedOut = Exceptions.unwrap(e) instanceof TimeoutException;
            throw new PaymentProcessorException(
                    String.format("Custodian %s failed: key=%s, timedOut=%s", operation,
                            instruction.idempotencyKey(), timedOut),
                    timedOut, e);
        }
    }
}

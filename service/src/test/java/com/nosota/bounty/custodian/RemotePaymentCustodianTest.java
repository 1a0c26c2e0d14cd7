package com.nosota.bounty.custodian;

import com.nosota.bounty.api.model.WalletTransactionType;
import com.nosota.bounty.config.BountyProperties;
import com.nosota.bounty.error.PaymentProcessorException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemotePaymentCustodianTest {

    private final CustodyInstruction instruction = CustodyInstruction.of(
            UUID.randomUUID(), UUID.randomUUID(), new BigDecimal("25.00"), WalletTransactionType.ESCROW);

    @Test
    void holdPostsWithIdempotencyKey() {
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        RemotePaymentCustodian custodian = custodian(request -> {
            sent.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        }, Duration.ofSeconds(2));

        custodian.hold(instruction);

        assertThat(sent.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.get().url().getPath()).isEqualTo("/v1/custody/hold");
        assertThat(sent.get().headers().getFirst(RemotePaymentCustodian.IDEMPOTENCY_KEY_HEADER))
                .isEqualTo(instruction.idempotencyKey());
    }

    @Test
    void rejectedCallIsNotATimeout() {
        RemotePaymentCustodian custodian = custodian(
                request -> Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build()),
                Duration.ofSeconds(2));

        assertThatThrownBy(() -> custodian.release(instruction))
                .isInstanceOf(PaymentProcessorException.class)
                .extracting("timedOut")
                .isEqualTo(false);
    }

    @Test
    void slowCustodianTimesOut() {
        RemotePaymentCustodian custodian = custodian(request -> Mono.never(), Duration.ofMillis(100));

        assertThatThrownBy(() -> custodian.refund(instruction))
                .isInstanceOf(PaymentProcessorException.class)
                .extracting("timedOut")
                .isEqualTo(true);
    }

    private static RemotePaymentCustodian custodian(ExchangeFunction exchange, Duration timeout) {
        BountyProperties properties = new BountyProperties();
        properties.getCustodian().setMode("remote");
        properties.getCustodian().setBaseUrl("http://custodian.test");
        properties.getCustodian().setTimeout(timeout);
        return new RemotePaymentCustodian(WebClient.builder().exchangeFunction(exchange), properties);
    }
}

package com.nosota.bounty.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Lifecycle engine settings bound from {@code bounty.*}.
 */
@ConfigurationProperties(prefix = "bounty")
@NoArgsConstructor
@Getter
@Setter
public class BountyProperties {

    private final Revision revision = new Revision();

    private final Custodian custodian = new Custodian();

    private final Notifications notifications = new Notifications();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Revision {

        /**
         * Revisions a poster may request from one hunter on one bounty. Past this, only a dispute moves it forward.
         */
        private int maxCycles = 3;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Custodian {

        /** {@code ledger} (platform ledger is the custodian) or {@code remote}. */
        private String mode = "ledger";

        /** Base URL of the remote custodian, used when mode is {@code remote}. */
        private String baseUrl = "http://localhost:8090";

        /** Upper bound for one custodian call. A slower answer fails the operation with EXTERNAL_PAYMENT_TIMEOUT. */
        private Duration timeout = Duration.ofSeconds(5);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Notifications {

        /** {@code log} or {@code rabbit}. */
        private String transport = "log";

        /** Topic exchange lifecycle events are published to when transport is {@code rabbit}. */
        private String exchange = "bounty-lifecycle";
    }
}

package com.chainwatch.ingestion.config;

import com.chainwatch.domain.Commitment;
import com.chainwatch.ingestion.watch.WatchKind;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Watch targets started at application startup (chainwatch.watch.targets[n]).
 */
@ConfigurationProperties(prefix = "chainwatch.watch")
@NoArgsConstructor
@Getter
@Setter
public class WatchTargetsProperties {

    private List<Target> targets = new ArrayList<>();

    public void setTargets(List<Target> targets) {
        this.targets = targets != null ? targets : new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Target {

        private WatchKind kind;

        /** Account address, program id, or for TRANSACTION_LOGS the optional "mentions" address. */
        private String address;

        /** TRANSACTION_LOGS only: all | allWithVotes | mentions. Defaults to mentions when address is set. */
        private String filter;

        /** Overrides chainwatch.watcher.commitment. */
        private Commitment commitment;
    }
}

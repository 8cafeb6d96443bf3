package com.xammer.nodelabeler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code labeler.*} prefix.
 *
 * <p>{@code labels} and {@code annotations} hold {@code key[=template]} entries, e.g.
 * {@code provider-id={:last}} or {@code example.com/zone={0}}.
 */
@Data
@ConfigurationProperties(prefix = "labeler")
public class LabelerProperties {

    private List<String> labels = new ArrayList<>();
    private List<String> annotations = new ArrayList<>();

    /** Periodic re-check interval for every node. */
    private Duration requeueInterval = Duration.ofHours(1);

    private Reconciler reconciler = new Reconciler();
    private Retry retry = new Retry();
    private Watch watch = new Watch();
    private Health health = new Health();
    private Kubernetes kubernetes = new Kubernetes();

    @Data
    public static class Reconciler {
        private int workers = 2;
        /** Quiet period used to coalesce bursts of events for the same node. */
        private Duration debounce = Duration.ofMillis(250);
    }

    @Data
    public static class Retry {
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class Watch {
        /** Informer resync period; zero disables resync. */
        private Duration resync = Duration.ZERO;
    }

    @Data
    public static class Health {
        /** Watch errors newer than this make {@code /health} report unhealthy. */
        private Duration errorWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class Kubernetes {
        /** Optional kubeconfig file; in-cluster or ~/.kube/config discovery when unset. */
        private String kubeconfig;
    }
}

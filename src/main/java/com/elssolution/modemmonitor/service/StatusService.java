package com.elssolution.modemmonitor.service;

import com.elssolution.modemmonitor.alerts.GlobalUncaughtHandler;
import com.elssolution.modemmonitor.detect.EscalationPolicy;
import com.elssolution.modemmonitor.domain.ChannelDirection;
import lombok.*;
import org.springframework.stereotype.Component;

/** Aggregates orchestrator counters for {@code /status} and the health indicator. */
@Component
public class StatusService {

    private final PollOrchestrator poller;
    private final EscalationPolicy escalation;
    private final GlobalUncaughtHandler uncaught;

    public StatusService(PollOrchestrator poller, EscalationPolicy escalation, GlobalUncaughtHandler uncaught) {
        this.poller = poller;
        this.escalation = escalation;
        this.uncaught = uncaught;
    }

    public StatusView buildStatusView() {
        long now = System.currentTimeMillis();
        long eventsAge = age(now, poller.getLastEventsOkMs());
        long dsAge = age(now, poller.getLastDownstreamOkMs());
        long usAge = age(now, poller.getLastUpstreamOkMs());

        return StatusView.builder()
                .phase(String.valueOf(poller.getPhase()))
                .pollIntervalSeconds(poller.getPollIntervalSeconds())
                .ticks(poller.ticks())
                .eventsAgeMs(eventsAge).eventsAgeHuman(humanAge(eventsAge))
                .downstreamAgeMs(dsAge).downstreamAgeHuman(humanAge(dsAge))
                .upstreamAgeMs(usAge).upstreamAgeHuman(humanAge(usAge))
                .downstreamChannels(poller.channels(ChannelDirection.DOWNSTREAM).size())
                .upstreamChannels(poller.channels(ChannelDirection.UPSTREAM).size())
                .watermark(poller.currentWatermark().map(String::valueOf).orElse("-"))
                .watermarkPersistPending(poller.isPersistPending())
                .dedupMode(String.valueOf(poller.dedupMode()))
                .escalationMode(String.valueOf(escalation.mode()))
                .suppressNotice(poller.isSuppressNotice())
                .eventsForwarded(poller.eventsForwarded())
                .eventsSuppressed(poller.eventsSuppressed())
                .anomaliesDetected(poller.anomaliesDetected())
                .anomaliesRaised(poller.anomaliesRaised())
                .anomaliesResolved(poller.anomaliesResolved())
                .activeAnomalies(poller.activeAnomalies().size())
                .fetchFailures(poller.fetchFailures())
                .uncaughtErrors(uncaught.uncaughtCount())
                .lastUncaught(uncaught.lastUncaught())
                .build();
    }

    /**
     * Freshest successful fetch of any source, or -1 if none yet.
     */
    public long freshestFetchAgeMs() {
        long newest = Math.max(poller.getLastEventsOkMs(),
                Math.max(poller.getLastDownstreamOkMs(), poller.getLastUpstreamOkMs()));
        return age(System.currentTimeMillis(), newest);
    }

    // ---------------------- formatting helpers ----------------------

    private static long age(long now, long ts) { return ts == 0L ? -1 : Math.max(0, now - ts); }

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        String phase;
        int    pollIntervalSeconds;
        long   ticks;

        long   eventsAgeMs;     String eventsAgeHuman;
        long   downstreamAgeMs; String downstreamAgeHuman;
        long   upstreamAgeMs;   String upstreamAgeHuman;
        int    downstreamChannels;
        int    upstreamChannels;

        String  watermark;
        boolean watermarkPersistPending;
        String  dedupMode;
        String  escalationMode;
        boolean suppressNotice;

        long eventsForwarded;
        long eventsSuppressed;
        long anomaliesDetected;
        long anomaliesRaised;
        long anomaliesResolved;
        int  activeAnomalies;
        long fetchFailures;
        long uncaughtErrors;
        String lastUncaught;
    }
}

package com.elssolution.modemmonitor.web;

import com.elssolution.modemmonitor.alerts.AnomalyEpisodes;
import com.elssolution.modemmonitor.alerts.NotificationService;
import com.elssolution.modemmonitor.domain.ChannelDirection;
import com.elssolution.modemmonitor.domain.ChannelReading;
import com.elssolution.modemmonitor.integration.hitron.HitronDeviceInfo;
import com.elssolution.modemmonitor.integration.hitron.HitronModemClient;
import com.elssolution.modemmonitor.service.PollOrchestrator;
import com.elssolution.modemmonitor.service.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class StatusController {

    private final StatusService status;
    private final PollOrchestrator poller;
    private final NotificationService notifications;
    private final HitronModemClient modem;

    public StatusController(StatusService status, PollOrchestrator poller, NotificationService notifications,
                            HitronModemClient modem) {
        this.status = status;
        this.poller = poller;
        this.notifications = notifications;
        this.modem = modem;
    }

    @GetMapping("/status")
    public StatusService.StatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/channels")
    public Map<String, Collection<ChannelReading>> getChannels() {
        Map<String, Collection<ChannelReading>> out = new LinkedHashMap<>();
        for (ChannelDirection d : ChannelDirection.values()) {
            out.put(d.name().toLowerCase(java.util.Locale.ROOT), poller.channels(d).values());
        }
        return out;
    }

    @GetMapping("/notifications")
    public List<NotificationService.NotificationView> getNotifications(
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        List<NotificationService.NotificationView> all = notifications.recent();
        int cap = Math.max(1, Math.min(limit, 50));
        return all.size() <= cap ? all : all.subList(0, cap);
    }

    @GetMapping("/anomalies")
    public List<AnomalyEpisodes.EpisodeView> getActiveAnomalies() {
        return poller.activeAnomalies();
    }

    /** Reads the modem's diagnostic pages now; not part of the poll loop. */
    @GetMapping("/device")
    public HitronDeviceInfo getDevice() {
        return modem.fetchDeviceInfo();
    }
}

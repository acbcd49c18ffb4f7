package com.elssolution.modemmonitor.integration.discord;

import com.elssolution.modemmonitor.alerts.AnomalyEpisodes;
import com.elssolution.modemmonitor.alerts.NotificationService;
import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.EventPriority;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/** Posts one embed per event or anomaly to a Discord webhook. */
@Slf4j
@Component
public class DiscordWebhookSink implements NotificationService.NotificationSink {

    static final int COLOR_RED = 0xFF0000;
    static final int COLOR_ORANGE = 0xFFA500;
    static final int COLOR_BLUE = 0x0099FF;
    static final int COLOR_GRAY = 0x808080;
    static final int COLOR_GREEN = 0x2ECC71;

    @Value("${alert.discord.enabled:false}")       boolean enabled;
    @Value("${alert.discord.webhookUrl:}")         String webhookUrl;
    @Value("${alert.discord.roleId:}")             String roleId;         // optional mention
    @Value("${alert.discord.requestTimeoutMs:5000}") int requestTimeoutMs;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(4))
            .build();

    @PostConstruct
    void init() {
        log.info("Discord sink registered: enabled={} webhookSet={} roleSet={}",
                enabled, webhookUrl != null && !webhookUrl.isBlank(), hasRole());
    }

    @Override public String name() { return "discord"; }

    @Override public boolean enabled() { return enabled && webhookUrl != null && !webhookUrl.isBlank(); }

    @Override public boolean onEvent(EventLogEntry e) { return post(eventPayload(e)); }

    @Override public boolean onAnomaly(Anomaly a) { return post(anomalyPayload(a)); }

    @Override public boolean onResolved(AnomalyEpisodes.EpisodeView episode) { return post(resolvedPayload(episode)); }

    @Override public boolean onLifecycle(String text) { return post(embed("Modem Monitor", COLOR_GREEN, text, false)); }

    // ---- payloads ----

    /** Notice events never ping the role. */
    ObjectNode eventPayload(EventLogEntry e) {
        String description = "**Time:** " + e.time() + "\n"
                + "**Type:** " + e.type() + "\n"
                + "**Event:** " + e.message();
        return embed("Modem Event: " + e.priority().label(), colorOf(e.priority()), description,
                e.priority() != EventPriority.NOTICE);
    }

    ObjectNode anomalyPayload(Anomaly a) {
        String title = (a.escalation() ? "🔴 " : "⚠️ ") + a.title();
        return embed(title, a.escalation() ? COLOR_RED : COLOR_ORANGE, a.describe(), true);
    }

    ObjectNode resolvedPayload(AnomalyEpisodes.EpisodeView episode) {
        String description = episode.getMessage() + "\n\n**Cleared after:** " + episode.getPolls() + " poll(s)";
        return embed("✅ Resolved: " + episode.getTitle(), COLOR_GREEN, description, false);
    }

    static int colorOf(EventPriority p) {
        return switch (p) {
            case CRITICAL -> COLOR_RED;
            case WARNING -> COLOR_ORANGE;
            case NOTICE -> COLOR_BLUE;
            case OTHER -> COLOR_GRAY;
        };
    }

    private ObjectNode embed(String title, int color, String description, boolean mention) {
        ObjectNode root = objectMapper.createObjectNode();
        if (mention && hasRole()) {
            root.put("content", "<@&" + roleId.trim() + ">");
            root.putObject("allowed_mentions").putArray("roles").add(roleId.trim());
        }
        ObjectNode embed = root.putArray("embeds").addObject();
        embed.put("title", title);
        embed.put("color", color);
        embed.put("description", description);
        embed.put("timestamp", Instant.now().toString());
        return root;
    }

    private boolean hasRole() { return roleId != null && !roleId.isBlank(); }

    // ---- transport ----

    private boolean post(ObjectNode payload) {
        if (!enabled()) return false;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(webhookUrl))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofMillis(Math.max(1000, requestTimeoutMs)))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            boolean ok = resp.statusCode() / 100 == 2;
            if (!ok) log.warn("Discord send failed ({}): {}", resp.statusCode(), resp.body());
            else     log.debug("Discord sent ({})", resp.statusCode());
            return ok;
        } catch (JsonProcessingException e) {
            log.warn("Discord payload not serializable: {}", e.getOriginalMessage());
            return false;
        } catch (IOException e) {
            log.warn("Discord send exception: {}", e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

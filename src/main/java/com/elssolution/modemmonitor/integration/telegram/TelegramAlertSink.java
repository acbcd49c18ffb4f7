package com.elssolution.modemmonitor.integration.telegram;

import com.elssolution.modemmonitor.alerts.AnomalyEpisodes;
import com.elssolution.modemmonitor.alerts.NotificationService;
import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Markdown messages to one or more Telegram chats via the Bot API. */
@Slf4j
@Component
public class TelegramAlertSink implements NotificationService.NotificationSink {

    @Value("${alert.telegram.enabled:false}")   private boolean enabled;
    @Value("${alert.telegram.botToken:}")       private String botToken;
    @Value("${alert.telegram.chatIds:}")        private String chatIdsCsv;     // comma-separated
    @Value("${alert.telegram.prefix:}")         String prefix;                 // device tag
    @Value("${alert.telegram.requestTimeoutMs:5000}") private int requestTimeoutMs;

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(4))
            .build();
    private List<String> targets = List.of();

    String apiUrl() { return "https://api.telegram.org/bot" + botToken + "/sendMessage"; }

    @PostConstruct
    void init() {
        targets = Arrays.stream(Optional.ofNullable(chatIdsCsv).orElse("")
                        .split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        log.info("Telegram sink registered: enabled={} tokenSet={} targets={}",
                enabled, botToken != null && !botToken.isBlank(), targets);
    }

    @Override public String name() { return "telegram"; }

    @Override public boolean enabled() {
        return enabled && botToken != null && !botToken.isBlank() && !targets.isEmpty();
    }

    @Override public boolean onEvent(EventLogEntry e) {
        return sendWithPrefix("📟 *" + e.priority().name() + "* `" + esc(e.type()) + "`\n"
                + esc(e.message()) + "\n"
                + "_time:_ " + esc(e.time()));
    }

    @Override public boolean onAnomaly(Anomaly a) {
        return sendWithPrefix((a.escalation() ? "🔴" : "⚠️") + " *" + esc(a.title()) + "* `"
                + esc(a.key()) + "`\n" + esc(a.describe()));
    }

    @Override public boolean onResolved(AnomalyEpisodes.EpisodeView e) {
        return sendWithPrefix("✅ *RECOVERED* `" + esc(e.getKey()) + "`\n"
                + esc(e.getTitle()) + "\n"
                + "_polls:_ " + e.getPolls());
    }

    @Override public boolean onLifecycle(String text) {
        return sendWithPrefix(esc(text));
    }

    boolean sendWithPrefix(String bodyMarkdown) {
        String hdr = (prefix == null || prefix.isBlank()) ? "" : "*" + esc(prefix) + "*\n";
        boolean ok = true;
        for (String chatId : targets) ok &= sendOne(chatId, hdr + bodyMarkdown);
        return ok;
    }

    private boolean sendOne(String chatId, String markdownText) {
        try {
            String body = "chat_id=" + url(chatId)
                    + "&parse_mode=Markdown"
                    + "&text=" + url(markdownText);
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl()))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .timeout(Duration.ofMillis(Math.max(1000, requestTimeoutMs)))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            boolean ok = resp.statusCode() / 100 == 2;
            if (!ok) log.warn("Telegram send failed ({}): {}", resp.statusCode(), resp.body());
            else     log.debug("Telegram sent to {} ({})", chatId, resp.statusCode());
            return ok;
        } catch (IOException e) {
            log.warn("Telegram send exception to {}: {}", chatId, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String url(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }
    static String esc(String s) { return s == null ? "" : s.replace("_", "\\_").replace("*", "\\*").replace("`", "\\`"); }
}

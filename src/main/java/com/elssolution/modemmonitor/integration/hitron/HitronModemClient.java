package com.elssolution.modemmonitor.integration.hitron;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.EventPriority;
import com.elssolution.modemmonitor.domain.UpstreamChannel;
import com.elssolution.modemmonitor.service.TelemetryFetchException;
import com.elssolution.modemmonitor.service.TelemetryFetchException.Reason;
import com.elssolution.modemmonitor.service.TelemetrySource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the Hitron CODA diagnostic pages under {@code /data}.
 * Only fetches and maps payloads; no thresholds or dedup here.
 *
 * The modem serves JSON arrays with every number quoted ("frequency":"591000000"),
 * so numeric fields are read leniently.
 */
@Slf4j
@Service
public class HitronModemClient implements TelemetrySource {

    // ----- Config -----
    @Value("${modem.baseUrl:https://192.168.100.1/data}")
    private String baseUrl;

    /** Per-request timeout (ms). */
    @Value("${modem.http.requestTimeoutMs:5000}")
    private int requestTimeoutMs;

    /** The modem ships a self-signed certificate for a name it is never reached by. */
    @Value("${modem.http.insecureTls:true}")
    private boolean insecureTls;

    // ----- Endpoints -----
    static final String PATH_DOWNSTREAM = "dsinfo.asp";
    static final String PATH_UPSTREAM = "usinfo.asp";
    static final String PATH_EVENT_LOG = "status_log.asp";
    static final String PATH_SYSTEM_MODEL = "system_model.asp";
    static final String PATH_SYS_INFO = "getSysInfo.asp";
    static final String PATH_LINK_STATUS = "getLinkStatus.asp";
    static final String PATH_DOCSIS_WAN = "getCmDocsisWan.asp";
    static final String PATH_DS_OFDM = "dsofdminfo.asp";
    static final String PATH_US_OFDM = "usofdminfo.asp";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpClient httpClient;

    @PostConstruct
    void init() {
        HttpClient.Builder b = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(Math.max(1000, requestTimeoutMs)));
        if (insecureTls) b.sslContext(trustAllContext());
        httpClient = b.build();
        log.info("Hitron client ready: baseUrl={} timeoutMs={} insecureTls={}", baseUrl, requestTimeoutMs, insecureTls);
    }

    // ===== TelemetrySource =====

    @Override
    public List<DownstreamChannel> fetchDownstream() throws TelemetryFetchException {
        List<DownstreamChannel> out = parseDownstream(get(PATH_DOWNSTREAM));
        log.debug("Parsed {} downstream channels", out.size());
        return out;
    }

    @Override
    public List<UpstreamChannel> fetchUpstream() throws TelemetryFetchException {
        List<UpstreamChannel> out = parseUpstream(get(PATH_UPSTREAM));
        log.debug("Parsed {} upstream channels", out.size());
        return out;
    }

    @Override
    public List<EventLogEntry> fetchEvents() throws TelemetryFetchException {
        List<EventLogEntry> out = parseEvents(get(PATH_EVENT_LOG));
        log.debug("Parsed {} events", out.size());
        return out;
    }

    // ===== Device diagnostics =====

    /** One request per page; a failing page is reported in the result and does not stop the rest. */
    public HitronDeviceInfo fetchDeviceInfo() {
        HitronDeviceInfo info = readDeviceInfo(this::get);
        if (!info.complete()) log.warn("device_info_partial failed={}", info.getErrors().keySet());
        return info;
    }

    @FunctionalInterface
    interface PageSource {
        String body(String endpoint) throws TelemetryFetchException;
    }

    HitronDeviceInfo readDeviceInfo(PageSource pages) {
        Map<String, String> errors = new LinkedHashMap<>();
        return HitronDeviceInfo.builder()
                .fetchedAtMs(System.currentTimeMillis())
                .systemModel(section(pages, PATH_SYSTEM_MODEL, errors))
                .systemInfo(section(pages, PATH_SYS_INFO, errors))
                .linkStatus(section(pages, PATH_LINK_STATUS, errors))
                .docsisWan(section(pages, PATH_DOCSIS_WAN, errors))
                .downstreamOfdm(section(pages, PATH_DS_OFDM, errors))
                .upstreamOfdm(section(pages, PATH_US_OFDM, errors))
                .errors(Collections.unmodifiableMap(errors))
                .build();
    }

    private JsonNode section(PageSource pages, String endpoint, Map<String, String> errors) {
        try {
            return container(endpoint, pages.body(endpoint));
        } catch (TelemetryFetchException e) {
            log.debug("device_page_failed endpoint={} reason={} msg={}", endpoint, e.getReason(), e.getMessage());
            errors.put(endpoint, e.getReason() + ": " + e.getMessage());
            return null;
        }
    }

    /** Any JSON object or array is accepted; field names vary between firmware versions. */
    private JsonNode container(String endpoint, String body) throws TelemetryFetchException {
        JsonNode root = readJson(endpoint, body);
        if (root == null || !root.isContainerNode()) {
            throw new TelemetryFetchException(Reason.PARSE, endpoint, "expected a JSON object or array, got " + truncate(body, 80));
        }
        return root;
    }

    // ===== Payload mapping =====

    List<DownstreamChannel> parseDownstream(String body) throws TelemetryFetchException {
        List<DownstreamChannel> out = new ArrayList<>();
        for (JsonNode n : array(PATH_DOWNSTREAM, body)) {
            out.add(new DownstreamChannel(
                    reqInt(PATH_DOWNSTREAM, n, "channelId"),
                    optInt(n, "portId"),
                    reqNum(PATH_DOWNSTREAM, n, "frequency"),
                    n.path("modulation").asText(""),
                    reqNum(PATH_DOWNSTREAM, n, "signalStrength"),
                    reqNum(PATH_DOWNSTREAM, n, "snr"),
                    reqLong(PATH_DOWNSTREAM, n, "correcteds"),
                    reqLong(PATH_DOWNSTREAM, n, "uncorrect")));
        }
        return out;
    }

    List<UpstreamChannel> parseUpstream(String body) throws TelemetryFetchException {
        List<UpstreamChannel> out = new ArrayList<>();
        for (JsonNode n : array(PATH_UPSTREAM, body)) {
            out.add(new UpstreamChannel(
                    reqInt(PATH_UPSTREAM, n, "channelId"),
                    optInt(n, "portId"),
                    reqNum(PATH_UPSTREAM, n, "frequency"),
                    n.path("bandwidth").asText(""),
                    n.path("modtype").asText(""),
                    reqNum(PATH_UPSTREAM, n, "signalStrength")));
        }
        return out;
    }

    /** Device order is newest first; an ascending payload is flipped to match. */
    List<EventLogEntry> parseEvents(String body) throws TelemetryFetchException {
        List<EventLogEntry> out = new ArrayList<>();
        for (JsonNode n : array(PATH_EVENT_LOG, body)) {
            out.add(new EventLogEntry(
                    reqLong(PATH_EVENT_LOG, n, "index"),
                    n.path("time").asText(""),
                    n.path("type").asText(""),
                    EventPriority.fromDevice(n.path("priority").asText(null)),
                    n.path("event").asText("")));
        }
        if (out.size() > 1 && out.get(0).index() < out.get(out.size() - 1).index()) {
            Collections.reverse(out);
        }
        return out;
    }

    // ===== HTTP =====

    private String get(String endpoint) throws TelemetryFetchException {
        String url = safeJoin(baseUrl, endpoint);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(Math.max(1000, requestTimeoutMs)))
                .GET()
                .build();
        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            int sc = resp.statusCode();
            if (sc / 100 != 2) {
                throw new TelemetryFetchException(Reason.HTTP_STATUS, endpoint,
                        "HTTP " + sc + " from " + endpoint + ": " + truncate(resp.body(), 200));
            }
            if (log.isTraceEnabled()) log.trace("GET {} -> {} bytes", url, resp.body().length());
            return resp.body();
        } catch (HttpTimeoutException e) {
            throw new TelemetryFetchException(Reason.TIMEOUT, endpoint, "timeout after " + requestTimeoutMs + " ms", e);
        } catch (IOException e) {
            throw new TelemetryFetchException(Reason.NETWORK, endpoint, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelemetryFetchException(Reason.NETWORK, endpoint, "interrupted", e);
        }
    }

    // ===== Helpers =====

    private JsonNode readJson(String endpoint, String body) throws TelemetryFetchException {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new TelemetryFetchException(Reason.PARSE, endpoint, "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode array(String endpoint, String body) throws TelemetryFetchException {
        JsonNode root = readJson(endpoint, body);
        if (root == null || !root.isArray()) {
            throw new TelemetryFetchException(Reason.PARSE, endpoint, "expected a JSON array, got " + truncate(body, 80));
        }
        return root;
    }

    /** Reads a numeric field; handles numbers-as-strings too. */
    private static Double nodeNum(JsonNode obj, String field) {
        JsonNode n = obj.path(field);
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual()) {
            try {
                return Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double reqNum(String endpoint, JsonNode obj, String field) throws TelemetryFetchException {
        Double v = nodeNum(obj, field);
        if (v == null || v.isNaN()) {
            throw new TelemetryFetchException(Reason.PARSE, endpoint,
                    "field '" + field + "' missing or not numeric: " + truncate(obj.toString(), 160));
        }
        return v;
    }

    private static long reqLong(String endpoint, JsonNode obj, String field) throws TelemetryFetchException {
        return Math.round(reqNum(endpoint, obj, field));
    }

    private static int reqInt(String endpoint, JsonNode obj, String field) throws TelemetryFetchException {
        return (int) reqLong(endpoint, obj, field);
    }

    private static int optInt(JsonNode obj, String field) {
        Double v = nodeNum(obj, field);
        return v == null ? 0 : (int) Math.round(v);
    }

    private static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "...";
    }

    private static String safeJoin(String base, String path) {
        if (base == null) return path;
        if (base.endsWith("/")) return base + path;
        return base + "/" + path;
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new AcceptAnyCertificate()}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot build TLS context for the modem", e);
        }
    }

    /** Extended variant so JSSE skips endpoint identification as well. */
    private static final class AcceptAnyCertificate extends X509ExtendedTrustManager {
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
    }
}

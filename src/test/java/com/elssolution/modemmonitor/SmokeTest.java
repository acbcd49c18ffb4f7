package com.elssolution.modemmonitor;

import com.elssolution.modemmonitor.integration.hitron.HitronDeviceInfo;
import com.elssolution.modemmonitor.integration.hitron.HitronModemClient;
import com.elssolution.modemmonitor.integration.telegram.TelegramAlertSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                // No state file, no webhooks
                "monitor.stateFile=",
                "alert.discord.enabled=false",
                "alert.startupPing=false",
                "alert.shutdownPing=false",

                "monitor.escalation.mode=DELTA",
                "monitor.events.dedupMode=PREFIX_DIFF",

                // Bind UI to random port only
                "server.port=0"
        }
)
class SmokeTest {

    @LocalServerPort int port;

    @Autowired TestRestTemplate http;

    // Mocks for anything scheduling or I/O
    @MockitoBean ScheduledExecutorService scheduler;
    @MockitoBean HitronModemClient modem;
    @MockitoBean TelegramAlertSink telegram;

    @Test
    void status_endpoint_returns_200() {
        var resp = http.getForEntity("http://localhost:" + port + "/status", String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody())
                .contains("\"watermark\":\"-\"")
                .contains("\"dedupMode\":\"PREFIX_DIFF\"")
                .contains("\"escalationMode\":\"DELTA\"");
    }

    @Test
    void channels_endpoint_lists_both_directions() {
        var resp = http.getForEntity("http://localhost:" + port + "/channels", String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("downstream").contains("upstream");
    }

    @Test
    void notifications_endpoint_returns_200() {
        var resp = http.getForEntity("http://localhost:" + port + "/notifications?limit=5", String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).startsWith("[");
    }

    @Test
    void anomalies_endpoint_starts_empty() {
        var resp = http.getForEntity("http://localhost:" + port + "/anomalies", String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).isEqualTo("[]");
    }

    @Test
    void device_endpoint_returns_modem_pages() {
        ObjectNode model = new ObjectMapper().createObjectNode().put("modelName", "CODA-4582");
        when(modem.fetchDeviceInfo()).thenReturn(HitronDeviceInfo.builder()
                .fetchedAtMs(1L)
                .systemModel(model)
                .errors(Map.of("usofdminfo.asp", "TIMEOUT: timeout"))
                .build());

        var resp = http.getForEntity("http://localhost:" + port + "/device", String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("CODA-4582").contains("usofdminfo.asp");
    }
}

package com.elssolution.modemmonitor.integration.hitron;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.EventPriority;
import com.elssolution.modemmonitor.domain.UpstreamChannel;
import com.elssolution.modemmonitor.service.TelemetryFetchException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HitronModemClientTest {

    private final HitronModemClient client = new HitronModemClient();

    @Test
    void parses_downstream_with_quoted_numbers() throws Exception {
        String body = """
                [{"portId":"1","frequency":"591000000","modulation":"256QAM","signalStrength":"3.200",
                  "snr":"40.366","channelId":"9","dsoctets":"0","correcteds":"12","uncorrect":"3"},
                 {"portId":"2","frequency":"597000000","modulation":"256QAM","signalStrength":-1.5,
                  "snr":38.9,"channelId":10,"correcteds":0,"uncorrect":0}]
                """;

        List<DownstreamChannel> out = client.parseDownstream(body);

        assertThat(out).containsExactly(
                new DownstreamChannel(9, 1, 591_000_000, "256QAM", 3.2, 40.366, 12, 3),
                new DownstreamChannel(10, 2, 597_000_000, "256QAM", -1.5, 38.9, 0, 0));
    }

    @Test
    void parses_upstream() throws Exception {
        String body = """
                [{"portId":"1","frequency":"36000000","bandwidth":"6400000","modtype":"64QAM",
                  "scdmaMode":"ATDMA","signalStrength":"44.250","channelId":"3"}]
                """;

        List<UpstreamChannel> out = client.parseUpstream(body);

        assertThat(out).containsExactly(new UpstreamChannel(3, 1, 36_000_000, "6400000", "64QAM", 44.25));
    }

    @Test
    void parses_events_and_keeps_newest_first() throws Exception {
        String body = """
                [{"index":"3","time":"03/05/24 14:02:11","type":"82000200","priority":"critical",
                  "event":"No Ranging Response received - T3 time-out"},
                 {"index":"2","time":"03/05/24 13:00:00","type":"84000500","priority":"notice","event":"Honoring MDD"},
                 {"index":"1","time":"03/04/24 09:12:45","type":"x","priority":"debug","event":"?"}]
                """;

        List<EventLogEntry> out = client.parseEvents(body);

        assertThat(out).extracting(EventLogEntry::index).containsExactly(3L, 2L, 1L);
        assertThat(out).extracting(EventLogEntry::priority)
                .containsExactly(EventPriority.CRITICAL, EventPriority.NOTICE, EventPriority.OTHER);
        assertThat(out.get(0).message()).isEqualTo("No Ranging Response received - T3 time-out");
    }

    @Test
    void ascending_event_payload_is_reversed() throws Exception {
        String body = """
                [{"index":1,"time":"03/04/24 09:12:45","type":"a","priority":"warning","event":"one"},
                 {"index":2,"time":"03/05/24 13:00:00","type":"b","priority":"warning","event":"two"}]
                """;

        assertThat(client.parseEvents(body)).extracting(EventLogEntry::index).containsExactly(2L, 1L);
    }

    @Test
    void missing_required_field_is_a_parse_failure() {
        String body = "[{\"channelId\":\"1\",\"frequency\":\"591000000\",\"signalStrength\":\"1\",\"correcteds\":\"0\",\"uncorrect\":\"0\"}]";

        assertThatThrownBy(() -> client.parseDownstream(body))
                .isInstanceOf(TelemetryFetchException.class)
                .hasMessageContaining("snr")
                .extracting("reason").isEqualTo(TelemetryFetchException.Reason.PARSE);
    }

    @Test
    void non_array_or_malformed_body_is_a_parse_failure() {
        assertThatThrownBy(() -> client.parseUpstream("{\"error\":\"login required\"}"))
                .isInstanceOf(TelemetryFetchException.class)
                .extracting("reason").isEqualTo(TelemetryFetchException.Reason.PARSE);

        assertThatThrownBy(() -> client.parseEvents("<html>"))
                .isInstanceOf(TelemetryFetchException.class)
                .extracting("endpoint").isEqualTo(HitronModemClient.PATH_EVENT_LOG);
    }

    @Test
    void empty_array_is_fine() throws Exception {
        assertThat(client.parseDownstream("[]")).isEmpty();
    }

    @Test
    void device_info_keeps_pages_as_returned_and_reports_failures_per_page() {
        Map<String, String> bodies = Map.of(
                HitronModemClient.PATH_SYSTEM_MODEL, "{\"modelName\":\"CODA-4582\",\"skipWizard\":\"1\"}",
                HitronModemClient.PATH_SYS_INFO, "[{\"swVersion\":\"7.1.1.2.2b9\",\"systemUptime\":\"05d:03h:12m:44s\"}]",
                HitronModemClient.PATH_LINK_STATUS, "[{\"LinkSpeed\":\"1000\",\"LinkDuplex\":\"Full\"}]",
                HitronModemClient.PATH_DOCSIS_WAN, "<html>login</html>",
                HitronModemClient.PATH_DS_OFDM, "[{\"receive\":\"0\",\"plclock\":\"YES\",\"SNR\":\"41\"}]");

        HitronDeviceInfo info = client.readDeviceInfo(endpoint -> {
            String body = bodies.get(endpoint);
            if (body == null) {
                throw new TelemetryFetchException(TelemetryFetchException.Reason.TIMEOUT, endpoint, "timeout");
            }
            return body;
        });

        assertThat(info.getSystemModel().path("modelName").asText()).isEqualTo("CODA-4582");
        assertThat(info.getSystemInfo().get(0).path("swVersion").asText()).isEqualTo("7.1.1.2.2b9");
        assertThat(info.getLinkStatus().isArray()).isTrue();
        assertThat(info.getDownstreamOfdm().get(0).path("SNR").asText()).isEqualTo("41");
        assertThat(info.getDocsisWan()).isNull();
        assertThat(info.getUpstreamOfdm()).isNull();
        assertThat(info.complete()).isFalse();
        assertThat(info.getErrors()).containsOnlyKeys(HitronModemClient.PATH_DOCSIS_WAN, HitronModemClient.PATH_US_OFDM);
        assertThat(info.getErrors().get(HitronModemClient.PATH_US_OFDM)).startsWith("TIMEOUT");
    }
}

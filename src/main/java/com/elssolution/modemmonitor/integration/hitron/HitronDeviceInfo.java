package com.elssolution.modemmonitor.integration.hitron;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Device diagnostics read on demand: model, system info, link status, DOCSIS WAN and the
 * OFDM channel pages. Sections are kept as the modem returned them. A section that could not
 * be fetched is {@code null} and its endpoint is listed in {@code errors}.
 */
@Value @Builder
public class HitronDeviceInfo {
    long fetchedAtMs;
    JsonNode systemModel;     // system_model.asp, object
    JsonNode systemInfo;      // getSysInfo.asp, array
    JsonNode linkStatus;      // getLinkStatus.asp, array
    JsonNode docsisWan;       // getCmDocsisWan.asp, array
    JsonNode downstreamOfdm;  // dsofdminfo.asp, array
    JsonNode upstreamOfdm;    // usofdminfo.asp, array
    Map<String, String> errors;

    public boolean complete() { return errors.isEmpty(); }
}

package com.elssolution.modemmonitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** Every {@link NotificationService.NotificationSink} bean (Discord, Telegram) gets registered. */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AlertSinksConfig {
    private final NotificationService notifications;
    private final List<NotificationService.NotificationSink> sinks;

    @PostConstruct
    void init() {
        sinks.forEach(notifications::registerSink);
        if (sinks.stream().noneMatch(NotificationService.NotificationSink::enabled)) {
            log.warn("No notification sink enabled; events and anomalies will only be logged");
        }
    }
}

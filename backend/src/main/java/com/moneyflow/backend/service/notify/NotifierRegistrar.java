package com.moneyflow.backend.service.notify;

import com.moneyflow.backend.service.alert.AlertEngine;
import com.moneyflow.backend.service.alert.AlertListener;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Wires channel and listener beans into the alert engine on startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotifierRegistrar {

    private final AlertEngine alertEngine;
    private final ObjectProvider<NotificationChannel> channels;
    private final ObjectProvider<AlertListener> listeners;

    @PostConstruct
    public void register() {
        channels.orderedStream().forEach(channel -> alertEngine.registerNotifier(channel.name(), channel));
        listeners.orderedStream().forEach(alertEngine::addListener);
        log.info("Alert channels active: {}", alertEngine.getRegisteredChannels());
    }
}

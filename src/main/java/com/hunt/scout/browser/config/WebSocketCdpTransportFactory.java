package com.hunt.scout.browser.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebSocketCdpTransportFactory implements CdpTransportFactory {

    private final DevToolsProperties properties;

    @Override
    public CdpTransport open(String wsUrl) {
        return WebSocketCdpTransport.open(wsUrl, properties.getConnectTimeoutMs());
    }
}

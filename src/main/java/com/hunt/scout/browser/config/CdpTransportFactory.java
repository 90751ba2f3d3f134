package com.hunt.scout.browser.config;

@FunctionalInterface
public interface CdpTransportFactory {

    /**
     * @throws CdpConnectionException если WS не открылся
     */
    CdpTransport open(String wsUrl);
}

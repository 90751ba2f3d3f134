package com.hunt.scout.browser.config;

import java.io.Closeable;

/**
 * Дуплексный канал до одного CDP target. Корреляцию id не делает, только байты туда-обратно.
 */
public interface CdpTransport extends Closeable {

    String getWsUrl();

    boolean isOpen();

    /**
     * @throws CdpConnectionException если канал закрыт или запись не прошла
     */
    void send(String message);

    /**
     * Следующее входящее сообщение (ответ или событие).
     *
     * @return сообщение, либо null если за timeoutMs ничего не пришло
     * @throws CdpConnectionException если канал закрылся или упал
     */
    String receive(long timeoutMs);

    @Override
    void close();
}

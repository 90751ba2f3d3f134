package com.hunt.scout.browser.config;

import java.io.Closeable;
import java.util.Map;

/**
 * Синхронный CDP канал до одной вкладки.
 * Не потокобезопасен: один логический вызывающий на соединение, остальные синхронизируются снаружи.
 */
public interface DevToolsSession extends Closeable {

    /**
     * Отправляет команду и блокируется до ответа с тем же id.
     * При сбое транспорта переподключается и повторяет команду; если и это не помогло, {@link CdpCommandException}.
     */
    CdpResponse send(String method, Map<String, Object> params);

    default CdpResponse send(String method) {
        return send(method, Map.of());
    }

    /**
     * Discovery + WS + Page/DOM/Runtime.enable. Повторный вызов на живом соединении ничего не делает.
     */
    void connect();

    ConnectionState getState();

    /** null пока не подключены */
    String getWsUrl();

    @Override
    void close();
}

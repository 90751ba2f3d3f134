package com.hunt.scout.browser.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Ответ на команду: {id, result} или {id, error}.
 * Ошибка протокола (например, у узла нет box model) это нормальный ответ, а не сбой транспорта.
 */
public record CdpResponse(int id, JsonNode result, JsonNode error) {

    public CdpResponse {
        if (result == null) result = MissingNode.getInstance();
    }

    public boolean isError() {
        return error != null && !error.isNull() && !error.isMissingNode();
    }

    public String errorMessage() {
        return isError() ? error.path("message").asText(error.toString()) : null;
    }
}

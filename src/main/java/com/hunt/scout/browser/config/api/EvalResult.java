package com.hunt.scout.browser.config.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Результат Runtime.evaluate с returnByValue.
 * <ul>
 *     <li>{@link Primitive}: значение пришло целиком (string/number/boolean/null, а также JSON массивы и объекты)</li>
 *     <li>{@link Opaque}: есть только текстовое description, значение потеряно</li>
 *     <li>{@link None}: ошибка протокола, исключение в скрипте, undefined или сбой соединения</li>
 * </ul>
 */
public sealed interface EvalResult permits EvalResult.Primitive, EvalResult.Opaque, EvalResult.None {

    record Primitive(JsonNode value) implements EvalResult {}

    record Opaque(String description) implements EvalResult {}

    record None(String reason) implements EvalResult {}

    /** значение Primitive, иначе null */
    default JsonNode valueOrNull() {
        return this instanceof Primitive p ? p.value() : null;
    }

    static EvalResult none(String reason) {
        return new None(reason);
    }
}

package io.mersel.services.patterns.application.models;

/**
 * Oracle'ın doğrulanmış yapısal yanıtı.
 *
 * @param nodeType Düğüm tipi
 * @param payload  Attribute, çocuk ve referanslar
 */
public record OracleFact(String nodeType, FactPayload payload) {
}

package io.mersel.services.patterns.application.models;

/**
 * Extraction oracle'a gönderilen sınırlı fragment isteği.
 *
 * @param fragment   Boyutu sınırlanmış XML fragment
 * @param schemaHint Şema ipucu
 * @param correction Önceki yanıt şemaya uymadıysa düzeltici talimat ({@code null}: ilk deneme)
 */
public record OracleRequest(
        String fragment,
        SchemaHint schemaHint,
        String correction
) {

    public OracleRequest withCorrection(String instruction) {
        return new OracleRequest(fragment, schemaHint, instruction);
    }

    /**
     * @param version      Şema versiyonu
     * @param messageRoot  Mesaj root'u
     * @param sectionPath  Section yolu
     * @param nodeTypeHint Yapılandırmadaki düğüm tipi ({@code null} olabilir)
     */
    public record SchemaHint(String version, String messageRoot, String sectionPath, String nodeTypeHint) {
    }
}

package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.NodeFact;
import io.mersel.services.patterns.application.models.NodeRelationship;
import io.mersel.services.patterns.application.models.PatternMatch;
import io.mersel.services.patterns.application.models.RunRecord;

import java.util.List;
import java.util.Optional;

/**
 * Çalıştırma kayıtları ve çalıştırmaya ait değiştirilemez fact/ilişki/eşleşme kayıtları.
 * <p>
 * Insert'ler en az bir kez semantiğindedir: aynı kimlikle tekrar yazma yok sayılır.
 */
public interface IRunStore {

    void saveRun(RunRecord run);

    void updateRun(RunRecord run);

    Optional<RunRecord> findRun(String workspaceId, String runId);

    void saveFacts(List<NodeFact> facts);

    List<NodeFact> findFacts(String workspaceId, String runId);

    void saveRelationships(List<NodeRelationship> relationships);

    List<NodeRelationship> findRelationships(String workspaceId, String runId);

    void saveMatches(List<PatternMatch> matches);

    List<PatternMatch> findMatches(String workspaceId, String runId);
}

package ca.gc.cra.courier.application.port;

import ca.gc.cra.courier.domain.classify.ClassificationResult;

/**
 * <strong>What:</strong> Port to a content classification backend.
 * <p><strong>Why:</strong> The orchestrator only needs a class and a distance score; how bytes are recognized is
 * the backend's concern.</p>
 * <p><strong>Role:</strong> Implemented by {@code PatternClassifier} and {@code ScriptedClassifier}.</p>
 * <p><strong>Thread-safety:</strong> Called from the simulation thread only.</p>
 *
 * @since 0.1.0
 */
public interface ClassifierPort {
  /**
   * Classifies payload bytes.
   *
   * @param payload payload bytes; must not be mutated
   * @return result; {@link ClassificationResult#unresolved()} when nothing matched
   * @throws RuntimeException when the backend fails; callers treat this as unresolved
   */
  ClassificationResult classify(byte[] payload);
}

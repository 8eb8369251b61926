package ca.gc.cra.courier.infrastructure.classify;

import ca.gc.cra.courier.application.port.ClassifierPort;
import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Classifier returning pre-set results in call order, for scenario runs.
 *
 * <p>Once the script is exhausted the last result repeats; an empty script answers
 * {@link ClassificationResult#unresolved()}. Failure steps throw {@link IllegalStateException} to imitate a broken
 * backend.</p>
 *
 * @since 0.1.0
 */
public final class ScriptedClassifier implements ClassifierPort {
  private final Deque<Step> steps = new ArrayDeque<>();
  private Step last;
  private int calls;

  /**
   * Creates an empty script.
   */
  public ScriptedClassifier() {}

  /**
   * Creates a script from results.
   *
   * @param results results in call order
   * @return classifier
   */
  public static ScriptedClassifier of(List<ClassificationResult> results) {
    ScriptedClassifier classifier = new ScriptedClassifier();
    results.forEach(classifier::thenReturn);
    return classifier;
  }

  /**
   * Parses a script of comma-separated {@code CLASS:score} entries, e.g. {@code "MESSI:40,RONALDO:120"}. A bare
   * {@code UNRESOLVED} entry needs no score.
   *
   * @param script script text
   * @return classifier
   * @throws ConfigurationException if an entry is malformed
   */
  public static ScriptedClassifier parse(String script) {
    Objects.requireNonNull(script, "script");
    List<ClassificationResult> results = new ArrayList<>();
    for (String raw : script.split(",")) {
      String entry = raw.trim();
      if (entry.isEmpty()) {
        continue;
      }
      String[] parts = entry.split(":", 2);
      try {
        DestinationClass cls = DestinationClass.fromString(parts[0]);
        if (!cls.isNamed()) {
          results.add(ClassificationResult.unresolved());
        } else if (parts.length < 2) {
          throw new ConfigurationException("classifierScript entry '" + entry + "' needs a score");
        } else {
          results.add(new ClassificationResult(cls, Double.parseDouble(parts[1].trim())));
        }
      } catch (NumberFormatException ex) {
        throw new ConfigurationException("classifierScript entry '" + entry + "' has an invalid score", ex);
      } catch (ConfigurationException ex) {
        throw ex;
      } catch (IllegalArgumentException ex) {
        throw new ConfigurationException("classifierScript entry '" + entry + "': " + ex.getMessage(), ex);
      }
    }
    return of(results);
  }

  /**
   * Appends a result.
   *
   * @param result result to return
   * @return this classifier
   */
  public ScriptedClassifier thenReturn(ClassificationResult result) {
    steps.addLast(new Step(Objects.requireNonNull(result, "result"), null));
    return this;
  }

  /**
   * Appends a failure.
   *
   * @param message failure message
   * @return this classifier
   */
  public ScriptedClassifier thenFail(String message) {
    steps.addLast(new Step(null, Objects.requireNonNull(message, "message")));
    return this;
  }

  /**
   * Number of classify calls so far.
   *
   * @return call count
   */
  public int calls() {
    return calls;
  }

  @Override
  public ClassificationResult classify(byte[] payload) {
    calls++;
    Step step = steps.isEmpty() ? last : steps.pollFirst();
    if (step == null) {
      return ClassificationResult.unresolved();
    }
    last = step;
    if (step.failure != null) {
      throw new IllegalStateException(step.failure);
    }
    return step.result;
  }

  private static final class Step {
    private final ClassificationResult result;
    private final String failure;

    private Step(ClassificationResult result, String failure) {
      this.result = result;
      this.failure = failure;
    }
  }
}

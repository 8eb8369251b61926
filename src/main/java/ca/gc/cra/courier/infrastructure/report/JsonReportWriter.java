package ca.gc.cra.courier.infrastructure.report;

import ca.gc.cra.courier.application.pipeline.PayloadOutcome;
import ca.gc.cra.courier.application.pipeline.SimulationSummary;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.ClassStatistics;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes a {@link SimulationSummary} as a JSON document.
 * <p><strong>Why:</strong> Gives downstream analysis a stable, machine-readable record of each run.</p>
 * <p><strong>Layout:</strong> {@code schemaVersion}, {@code run} totals, {@code payloads[]}, {@code flows[]}, and
 * {@code classes[]}. Undefined statistics (NaN) are written as {@code null}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter {
  private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes the report to a file, creating parent directories.
   *
   * @param summary run summary
   * @param target output file; replaced when present
   * @throws IOException if the file cannot be written
   */
  public void write(SimulationSummary summary, Path target) throws IOException {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(target, "target");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(target);
        JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      writeSummary(gen, summary);
    }
    log.info("Wrote run report to {}", target);
  }

  /**
   * Renders the report as a string.
   *
   * @param summary run summary
   * @return compact JSON
   * @throws IOException if generation fails
   */
  public String toJson(SimulationSummary summary) throws IOException {
    Writer writer = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(writer)) {
      writeSummary(gen, summary);
    }
    return writer.toString();
  }

  private void writeSummary(JsonGenerator gen, SimulationSummary summary) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
    gen.writeObjectFieldStart("run");
    gen.writeNumberField("horizonNanos", summary.horizonNanos());
    gen.writeNumberField("eventsExecuted", summary.eventsExecuted());
    gen.writeNumberField("payloads", summary.payloads().size());
    gen.writeNumberField("dropped", summary.droppedCount());
    gen.writeNumberField("interrupted", summary.interruptedCount());
    gen.writeNumberField("inconsistencies", summary.inconsistencyCount());
    gen.writeEndObject();

    gen.writeArrayFieldStart("payloads");
    for (PayloadOutcome outcome : summary.payloads()) {
      writePayload(gen, outcome);
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("flows");
    for (FlowStatistics flow : summary.flows()) {
      gen.writeStartObject();
      writeFlowFields(gen, flow);
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("classes");
    for (Map.Entry<DestinationClass, ClassStatistics> entry : summary.classes().entrySet()) {
      writeClass(gen, entry.getValue());
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private void writePayload(JsonGenerator gen, PayloadOutcome outcome) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("tag", outcome.tag());
    gen.writeStringField("label", outcome.label());
    gen.writeNumberField("length", outcome.length());
    writeNullableString(gen, "classifiedAs", outcome.classifiedAs() == null ? null : outcome.classifiedAs().name());
    writeDouble(gen, "score", outcome.score());
    writeNullableString(gen, "reason", outcome.reason() == null ? null : outcome.reason().name());
    writeNullableString(gen, "boundTo", outcome.boundTo() == null ? null : outcome.boundTo().name());
    gen.writeStringField("state", outcome.state().name());
    gen.writeNumberField("fragmentsPlanned", outcome.fragmentsPlanned());
    gen.writeNumberField("fragmentsSent", outcome.fragmentsSent());
    gen.writeNumberField("backpressureEvents", outcome.backpressureEvents());
    gen.writeBooleanField("interrupted", outcome.interrupted());
    if (outcome.statistics() != null) {
      gen.writeStringField("flow", outcome.statistics().key().toString());
    }
    gen.writeEndObject();
  }

  private void writeFlowFields(JsonGenerator gen, FlowStatistics flow) throws IOException {
    gen.writeStringField("source", flow.key().source().toString());
    gen.writeStringField("destination", flow.key().destination().toString());
    gen.writeNumberField("sent", flow.sent());
    gen.writeNumberField("received", flow.received());
    gen.writeNumberField("bytesSent", flow.bytesSent());
    gen.writeNumberField("bytesReceived", flow.bytesReceived());
    writeDouble(gen, "meanDelayNanos", flow.meanDelayNanos());
    writeDouble(gen, "throughputBps", flow.throughputBps());
    writeDouble(gen, "lossRatio", flow.lossRatio());
  }

  private void writeClass(JsonGenerator gen, ClassStatistics stats) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("class", stats.destinationClass().name());
    gen.writeNumberField("assigned", stats.assigned());
    gen.writeNumberField("flows", stats.flows());
    gen.writeNumberField("sent", stats.sent());
    gen.writeNumberField("received", stats.received());
    writeDouble(gen, "meanDelayNanos", stats.meanDelayNanos());
    writeDouble(gen, "throughputBps", stats.throughputBps());
    writeDouble(gen, "lossRatio", stats.lossRatio());
    gen.writeEndObject();
  }

  private static void writeDouble(JsonGenerator gen, String name, double value) throws IOException {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      gen.writeNullField(name);
    } else {
      gen.writeNumberField(name, value);
    }
  }

  private static void writeNullableString(JsonGenerator gen, String name, String value) throws IOException {
    if (value == null) {
      gen.writeNullField(name);
    } else {
      gen.writeStringField(name, value);
    }
  }
}

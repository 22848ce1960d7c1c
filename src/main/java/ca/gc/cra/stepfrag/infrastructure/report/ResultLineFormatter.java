package ca.gc.cra.stepfrag.infrastructure.report;

import ca.gc.cra.stepfrag.domain.convert.ConversionResult;
import ca.gc.cra.stepfrag.domain.convert.ConversionStats;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Encodes and decodes the single-line conversion result protocol.
 * <p><strong>Why:</strong> A calling process reads the converter's stdout and needs one machine-readable line it can
 * find among arbitrary diagnostic output.</p>
 * <p><strong>Role:</strong> Infrastructure formatter used by the {@code convert} command; {@link #extract(Iterable)}
 * serves callers that capture that command's output.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; {@link JsonFactory} is thread-safe.</p>
 *
 * <p>Line shape: {@code CONVERSION_RESULT_JSON: {"success":true,"message":"...","stats":{"inputSizeMB":"0.95",
 * "outputSizeMB":"0.10","compressionRatio":"90.0%","conversionTimeSeconds":"1.23"}}}. {@code stats} appears only on
 * success and {@code error} only on failure.</p>
 *
 * @since 0.1.0
 */
public final class ResultLineFormatter {
  /** Prefix identifying the result line. */
  public static final String MARKER = "CONVERSION_RESULT_JSON:";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Renders a result as a marker-prefixed single line.
   *
   * @param result conversion outcome; must not be {@code null}
   * @return line without a trailing newline
   */
  public String format(ConversionResult result) {
    Objects.requireNonNull(result, "result");
    StringWriter writer = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(writer)) {
      gen.writeStartObject();
      gen.writeBooleanField("success", result.success());
      gen.writeStringField("message", result.message());
      if (result.stats().isPresent()) {
        ConversionStats stats = result.stats().get();
        gen.writeObjectFieldStart("stats");
        gen.writeStringField("inputSizeMB", stats.inputSizeMB());
        gen.writeStringField("outputSizeMB", stats.outputSizeMB());
        gen.writeStringField("compressionRatio", stats.compressionRatio());
        gen.writeStringField("conversionTimeSeconds", stats.conversionTimeSeconds());
        gen.writeEndObject();
      }
      if (result.error().isPresent()) {
        gen.writeStringField("error", result.error().get());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode conversion result", ex);
    }
    return MARKER + " " + writer;
  }

  /**
   * Finds the last result line in captured output and decodes it.
   *
   * @param lines captured output lines in order
   * @return decoded result, or empty when no line carries the marker
   * @throws IllegalArgumentException if the marked line does not hold a valid result object
   */
  public Optional<ReportedResult> extract(Iterable<String> lines) {
    Objects.requireNonNull(lines, "lines");
    String payload = null;
    for (String line : lines) {
      if (line == null) {
        continue;
      }
      int idx = line.indexOf(MARKER);
      if (idx >= 0) {
        payload = line.substring(idx + MARKER.length()).trim();
      }
    }
    return payload == null ? Optional.empty() : Optional.of(parse(payload));
  }

  ReportedResult parse(String json) {
    try (JsonParser parser = factory.createParser(json)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Result payload is not a JSON object");
      }
      Boolean success = null;
      String message = null;
      String error = null;
      Map<String, String> stats = new LinkedHashMap<>();
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          throw new IllegalArgumentException("Expected field name but found " + token);
        }
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "success" -> success = value == JsonToken.VALUE_TRUE;
          case "message" -> message = parser.getValueAsString();
          case "error" -> error = parser.getValueAsString();
          case "stats" -> readStats(parser, value, stats);
          default -> parser.skipChildren();
        }
      }
      if (success == null || message == null) {
        throw new IllegalArgumentException("Result payload is missing success or message");
      }
      return new ReportedResult(success, message, stats, Optional.ofNullable(error));
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid result payload", ex);
    }
  }

  private static void readStats(JsonParser parser, JsonToken start, Map<String, String> stats) throws IOException {
    if (start != JsonToken.START_OBJECT) {
      parser.skipChildren();
      return;
    }
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String name = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (value.isScalarValue()) {
        stats.put(name, parser.getValueAsString());
      } else {
        parser.skipChildren();
      }
    }
  }

  /**
   * Result as seen by a calling process; statistics stay in their formatted string form.
   *
   * @param success whether the conversion succeeded
   * @param message summary line
   * @param stats formatted statistics keyed by field name; empty on failure
   * @param error failure cause
   */
  public record ReportedResult(
      boolean success, String message, Map<String, String> stats, Optional<String> error) {
    public ReportedResult {
      stats = Map.copyOf(stats);
    }
  }
}

package bisslog.infrastructure.tracing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.helpers.MessageFormatter;

/**
 * Turns a trace payload and its extras into one log line.
 *
 * <h3>Rules</h3>
 *
 * <ul>
 *   <li>Text payloads are used as-is; {@code {}} placeholders are filled from the format arguments.
 *   <li>Numbers, booleans, characters, enums and {@code null} are written with {@code
 *       String.valueOf}.
 *   <li>Anything else is serialised to JSON. Objects Jackson cannot serialise fall back to {@code
 *       String.valueOf}.
 *   <li>Non-empty extras are appended as {@code extra=<json object>}.
 * </ul>
 */
@Slf4j
public class TracePayloadRenderer {

  private final ObjectMapper objectMapper;

  public TracePayloadRenderer(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /** Renderer backed by a private {@link ObjectMapper} with java.time support. */
  public static TracePayloadRenderer withDefaults() {
    ObjectMapper mapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return new TracePayloadRenderer(mapper);
  }

  public String render(Object payload, Map<String, ?> extra, Object... args) {
    String message = renderPayload(payload, args);
    if (extra == null || extra.isEmpty()) {
      return message;
    }
    return message + " extra=" + toJson(extra);
  }

  String renderPayload(Object payload, Object[] args) {
    if (payload instanceof CharSequence text) {
      String pattern = text.toString();
      if (args == null || args.length == 0) {
        return pattern;
      }
      return MessageFormatter.arrayFormat(pattern, args).getMessage();
    }
    if (payload == null
        || payload instanceof Number
        || payload instanceof Boolean
        || payload instanceof Character
        || payload instanceof Enum<?>) {
      return String.valueOf(payload);
    }
    return toJson(payload);
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      // 직렬화 실패가 트레이스 자체를 막지 않도록 문자열로 폴백
      log.debug("Trace payload {} is not JSON serializable", value.getClass().getName(), e);
      return String.valueOf(value);
    }
  }
}

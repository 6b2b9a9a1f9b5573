package dev.rune.scheduler.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * The {@code credentials} object of a node. As stored it usually carries only a reference ({@code
 * id}, maybe {@code name}); once resolved it also carries the decrypted {@code values}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeCredentials(
    String id,
    @Nullable String name,
    @Nullable String type,
    @Nullable Map<String, Object> values) {

  public NodeCredentials {
    Objects.requireNonNull(id, "credential id must not be null");
    if (values != null) {
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
  }

  public static NodeCredentials reference(String id) {
    return new NodeCredentials(id, null, null, null);
  }

  public boolean isResolved() {
    return values != null;
  }
}

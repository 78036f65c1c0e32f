package dev.regula.answer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Diagram references cited by an answer. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaRefs(@Nullable List<String> images) {

  public MediaRefs {
    images = images == null ? null : Collections.unmodifiableList(new ArrayList<>(images));
  }
}

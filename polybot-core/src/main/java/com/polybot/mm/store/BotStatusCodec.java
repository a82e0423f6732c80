package com.polybot.mm.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Bot status values are stored as text: strings verbatim, everything else as JSON.
 */
@Slf4j
@RequiredArgsConstructor
class BotStatusCodec {

  private final ObjectMapper objectMapper;

  String encode(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String s) {
      return s;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize bot status value " + value, e);
    }
  }

  Set<String> decodeStringSet(String raw) {
    Set<String> out = new LinkedHashSet<>();
    if (raw == null || raw.isBlank()) {
      return out;
    }
    try {
      JsonNode node = objectMapper.readTree(raw);
      if (node != null && node.isArray()) {
        for (JsonNode item : node) {
          if (item.isTextual() && !item.asText().isBlank()) {
            out.add(item.asText());
          }
        }
      }
    } catch (JsonProcessingException e) {
      log.warn("unparseable bot status list '{}': {}", raw, e.getOriginalMessage());
    }
    return out;
  }
}

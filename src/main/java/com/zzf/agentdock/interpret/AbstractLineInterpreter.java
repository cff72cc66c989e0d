package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * JSON decoding shared by both formats.
 */
@Slf4j
public abstract class AbstractLineInterpreter<K extends Enum<K>> implements LineEventInterpreter<K> {
    protected final ObjectMapper objectMapper;

    protected AbstractLineInterpreter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<DecodedLine<K>> decode(String rawLine, long offset) {
        if (rawLine == null || rawLine.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawLine);
        } catch (JsonProcessingException e) {
            log.debug("line.skip reason=malformed format={} err={}", format(), e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        String uuid = JsonUtils.textOrNull(root, "uuid");
        String lineId = uuid != null ? uuid : DecodedLine.offsetId(offset);
        return Optional.of(new DecodedLine<>(classify(root), root, body(root),
                JsonUtils.instantOrNull(root, "timestamp"), lineId));
    }

    protected abstract K classify(JsonNode root);

    protected abstract JsonNode body(JsonNode root);
}

package com.mcpbuilder.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured message on a progress connection: a {@code type} tag, a {@code data}
 * payload and the time the frame was built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Frame(
    String type,
    Object data,
    Instant timestamp
) {

    public static Frame progress(ProgressUpdate update, Instant now) {
        return new Frame(FrameType.PROGRESS.wireName(), update, now);
    }

    public static Frame error(ErrorCode code, String message, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("code", code.name());
        return new Frame(FrameType.ERROR.wireName(), data, now);
    }

    public static Frame error(ErrorCode code, Instant now) {
        return error(code, code.defaultMessage(), now);
    }

    public static Frame ping(Instant now) {
        return new Frame(FrameType.PING.wireName(), Map.of("timestamp", now), now);
    }

    public static Frame pong(Instant now) {
        return new Frame(FrameType.PONG.wireName(), Map.of("timestamp", now), now);
    }
}

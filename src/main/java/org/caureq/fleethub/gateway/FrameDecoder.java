package org.caureq.fleethub.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.registry.PeriodicUpdate;
import org.caureq.fleethub.registry.RealtimeUpdate;
import org.caureq.fleethub.registry.StaticUpdate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single decode step for agent frames. Payload field names are normalized through an explicit
 * compatibility table (older agents use different names for the same field) before binding
 * to typed records. A frame carrying both a canonical name and an alias with different values
 * is rejected.
 */
@Component
@RequiredArgsConstructor
public class FrameDecoder {
    private final ObjectMapper objectMapper;

    /** Payload shape, used to pick the alias rules and the nested shapes. */
    enum Shape { SNAPSHOT, CPU, DISK, NETWORK, ACCEL, REALTIME, PERIODIC }

    record Alias(String canonical, List<String> aliases) {}

    private static final Map<Shape, List<Alias>> ALIASES = Map.of(
            Shape.SNAPSHOT, List.of(
                    new Alias("disks", List.of("disk")),
                    new Alias("networks", List.of("network")),
                    new Alias("gpus", List.of("gpu")),
                    new Alias("npus", List.of("npu")),
                    new Alias("userSessions", List.of("sessions")),
                    new Alias("systemInfo", List.of("system"))),
            Shape.CPU, List.of(new Alias("usagePercent", List.of("percent"))),
            Shape.DISK, List.of(
                    new Alias("mountPoint", List.of("mount")),
                    new Alias("readBytesPerSec", List.of("readBytesSec")),
                    new Alias("writeBytesPerSec", List.of("writeBytesSec"))),
            Shape.NETWORK, List.of(
                    new Alias("interface", List.of("name")),
                    new Alias("rxBytesPerSec", List.of("bytesRecv", "rxBytesSec")),
                    new Alias("txBytesPerSec", List.of("bytesSent", "txBytesSec")),
                    new Alias("up", List.of("isUp"))),
            Shape.ACCEL, List.of(new Alias("usagePercent", List.of("percent"))),
            Shape.REALTIME, List.of(
                    new Alias("diskIo", List.of("diskIO")),
                    new Alias("networkIo", List.of("networkIO")),
                    new Alias("gpus", List.of("gpuUsage", "gpu")),
                    new Alias("npus", List.of("npuUsage", "npu"))),
            Shape.PERIODIC, List.of(
                    new Alias("diskUsage", List.of("disks", "disk")),
                    new Alias("userSessions", List.of("sessions")),
                    new Alias("networkUpdates", List.of("networks", "network")),
                    new Alias("systemInfo", List.of("system")))
    );

    private static final Map<Shape, Map<String, Shape>> CHILDREN = Map.of(
            Shape.SNAPSHOT, Map.of("cpu", Shape.CPU, "disks", Shape.DISK, "networks", Shape.NETWORK,
                    "gpus", Shape.ACCEL, "npus", Shape.ACCEL),
            Shape.REALTIME, Map.of("diskIo", Shape.DISK, "networkIo", Shape.NETWORK,
                    "gpus", Shape.ACCEL, "npus", Shape.ACCEL),
            Shape.PERIODIC, Map.of("diskUsage", Shape.DISK, "networkUpdates", Shape.NETWORK)
    );

    public JsonNode parse(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed frame: " + e.getOriginalMessage(), e);
        }
    }

    public InboundFrame decode(String raw) {
        return decode(parse(raw));
    }

    public InboundFrame decode(JsonNode frame) {
        if (frame == null || !frame.isObject()) throw new ValidationException("frame must be a JSON object");
        var type = frame.path("type").asText("");
        var payload = frame.get("payload");
        if (payload != null && !payload.isObject() && !payload.isNull()) {
            throw new ValidationException("payload of " + type + " must be an object");
        }
        ObjectNode body = payload == null || payload.isNull()
                ? objectMapper.createObjectNode()
                : ((ObjectNode) payload).deepCopy();

        return switch (type) {
            case "auth" -> bind(body, InboundFrame.Auth.class);
            case "static_info" -> new InboundFrame.StaticInfo(bind(normalize(body, Shape.SNAPSHOT, type), StaticUpdate.class));
            case "periodic" -> new InboundFrame.Periodic(bind(normalize(body, Shape.PERIODIC, type), PeriodicUpdate.class));
            case "metrics" -> new InboundFrame.Snapshot(bind(normalize(body, Shape.SNAPSHOT, type), MetricSnapshot.class));
            case "realtime" -> new InboundFrame.Realtime(bind(normalize(body, Shape.REALTIME, type), RealtimeUpdate.class));
            case "heartbeat" -> new InboundFrame.Heartbeat(body.hasNonNull("timestamp")
                    ? bind(body.get("timestamp"), Instant.class) : null);
            case "command_result" -> {
                var r = bind(body, InboundFrame.CommandResult.class);
                if (r.commandId() == null || r.commandId().isBlank()) {
                    throw new ValidationException("command_result without commandId");
                }
                yield r;
            }
            case "goodbye" -> new InboundFrame.Goodbye(body.path("reason").asText(null));
            case "" -> throw new ValidationException("frame without type");
            default -> throw new ValidationException("unknown frame type: " + type);
        };
    }

    ObjectNode normalize(ObjectNode node, Shape shape, String path) {
        for (var alias : ALIASES.getOrDefault(shape, List.of())) {
            applyAlias(node, alias, path);
        }
        for (var child : CHILDREN.getOrDefault(shape, Map.of()).entrySet()) {
            var value = node.get(child.getKey());
            var childPath = path + "." + child.getKey();
            if (value instanceof ObjectNode obj) {
                normalize(obj, child.getValue(), childPath);
            } else if (value instanceof ArrayNode arr) {
                for (int i = 0; i < arr.size(); i++) {
                    if (arr.get(i) instanceof ObjectNode item) normalize(item, child.getValue(), childPath + "[" + i + "]");
                }
            }
        }
        return node;
    }

    private static void applyAlias(ObjectNode node, Alias alias, String path) {
        JsonNode chosen = node.get(alias.canonical());
        String chosenName = alias.canonical();
        List<String> present = new ArrayList<>();
        for (var a : alias.aliases()) {
            if (!node.has(a)) continue;
            present.add(a);
            var v = node.get(a);
            if (chosen == null) {
                chosen = v;
                chosenName = a;
            } else if (!sameValue(chosen, v)) {
                throw new ValidationException("conflicting values for " + path + "." + alias.canonical()
                        + ": '" + chosenName + "' and '" + a + "' differ");
            }
        }
        if (present.isEmpty()) return;
        node.remove(present);
        node.set(alias.canonical(), chosen);
    }

    private static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) return a.decimalValue().compareTo(b.decimalValue()) == 0;
        return a.equals(b);
    }

    private <T> T bind(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("invalid " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
    }
}

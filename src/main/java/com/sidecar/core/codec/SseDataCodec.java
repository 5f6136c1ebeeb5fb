package com.sidecar.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidecar.core.events.ApiVersion;
import com.sidecar.core.events.BlockAdded;
import com.sidecar.core.events.DeployAccepted;
import com.sidecar.core.events.DeployExpired;
import com.sidecar.core.events.DeployProcessed;
import com.sidecar.core.events.Fault;
import com.sidecar.core.events.FinalitySignature;
import com.sidecar.core.events.SseData;
import com.sidecar.core.events.SseDataVisitor;
import com.sidecar.core.events.SseEventType;
import com.sidecar.core.events.Step;
import com.sidecar.core.model.BlockHash;
import com.sidecar.core.model.Deploy;
import com.sidecar.core.model.DeployHash;
import com.sidecar.core.model.EraId;
import com.sidecar.core.model.ExecutionEffect;
import com.sidecar.core.model.ExecutionResult;
import com.sidecar.core.model.JsonBlock;
import com.sidecar.core.model.ProtocolVersion;
import com.sidecar.core.model.PublicKey;
import com.sidecar.core.model.TimeDiff;
import com.sidecar.core.model.Timestamp;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical JSON encoding of {@link SseData}.
 * <p>
 * Every event is written as an object with exactly one field, named after the event type,
 * whose value is the payload:
 * <pre>
 * {"ApiVersion": "1.5.2"}
 * {"DeployExpired": {"deploy_hash": "01000000..."}}
 * </pre>
 * {@code DeployAccepted} merges the deploy's own fields into its payload object, so the
 * payload looks exactly like the deploy. {@code FinalitySignature} does the same with the
 * wrapped signature.
 * <p>
 * Encoding is total for any constructed event. Decoding rejects malformed records with
 * {@link EventDecodeException} and unknown event types with {@link UnknownEventTypeException}.
 * Instances are thread-safe.
 */
@Component
public class SseDataCodec {

    private final ObjectMapper mapper;
    private final PayloadEncoder payloadEncoder = new PayloadEncoder();

    public SseDataCodec() {
        this(createObjectMapper());
    }

    SseDataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Mapper configured for the wire format: value-type bindings plus strict decoding of
     * missing, null and unknown fields.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new SidecarJsonModule())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectNode toJsonNode(SseData event) {
        ObjectNode root = mapper.createObjectNode();
        root.set(event.type().wireName(), event.accept(payloadEncoder));
        return root;
    }

    public String encode(SseData event) {
        try {
            return mapper.writeValueAsString(toJsonNode(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + event.type().wireName() + " event", e);
        }
    }

    public SseData decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EventDecodeException("Malformed event JSON: " + e.getOriginalMessage(), e);
        }
        return decode(root);
    }

    public SseData decode(JsonNode root) {
        if (root == null || !root.isObject() || root.size() != 1) {
            throw new EventDecodeException("Event must be an object with exactly one field naming its type");
        }
        Map.Entry<String, JsonNode> entry = root.fields().next();
        String wireName = entry.getKey();
        SseEventType type = SseEventType.fromWireName(wireName)
                .orElseThrow(() -> new UnknownEventTypeException(wireName));
        JsonNode payload = entry.getValue();
        if (payload.isNull()) {
            throw new EventDecodeException(wireName + " payload must not be null");
        }
        try {
            return decodePayload(type, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventDecodeException("Invalid " + wireName + " payload: " + e.getMessage(), e);
        }
    }

    private SseData decodePayload(SseEventType type, JsonNode payload) throws JsonProcessingException {
        return switch (type) {
            case API_VERSION -> new ApiVersion(mapper.treeToValue(payload, ProtocolVersion.class));
            case BLOCK_ADDED -> {
                expectFields(type, payload, "block_hash", "block");
                yield new BlockAdded(
                        read(payload, "block_hash", BlockHash.class),
                        read(payload, "block", JsonBlock.class));
            }
            case DEPLOY_ACCEPTED -> new DeployAccepted(mapper.treeToValue(payload, Deploy.class));
            case DEPLOY_PROCESSED -> {
                expectFields(type, payload, "deploy_hash", "account", "timestamp", "ttl",
                        "dependencies", "block_hash", "execution_result");
                JavaType hashList = mapper.getTypeFactory().constructCollectionType(List.class, DeployHash.class);
                List<DeployHash> dependencies = mapper.treeToValue(payload.get("dependencies"), hashList);
                if (dependencies.contains(null)) {
                    throw new EventDecodeException(type.wireName() + " dependencies must not contain null");
                }
                yield new DeployProcessed(
                        read(payload, "deploy_hash", DeployHash.class),
                        read(payload, "account", PublicKey.class),
                        read(payload, "timestamp", Timestamp.class),
                        read(payload, "ttl", TimeDiff.class),
                        dependencies,
                        read(payload, "block_hash", BlockHash.class),
                        read(payload, "execution_result", ExecutionResult.class));
            }
            case DEPLOY_EXPIRED -> {
                expectFields(type, payload, "deploy_hash");
                yield new DeployExpired(read(payload, "deploy_hash", DeployHash.class));
            }
            case FAULT -> {
                expectFields(type, payload, "era_id", "public_key", "timestamp");
                yield new Fault(
                        read(payload, "era_id", EraId.class),
                        read(payload, "public_key", PublicKey.class),
                        read(payload, "timestamp", Timestamp.class));
            }
            case FINALITY_SIGNATURE -> new FinalitySignature(
                    mapper.treeToValue(payload, com.sidecar.core.model.FinalitySignature.class));
            case STEP -> {
                expectFields(type, payload, "era_id", "execution_effect");
                yield new Step(
                        read(payload, "era_id", EraId.class),
                        read(payload, "execution_effect", ExecutionEffect.class));
            }
        };
    }

    private <T> T read(JsonNode payload, String field, Class<T> type) throws JsonProcessingException {
        return mapper.treeToValue(payload.get(field), type);
    }

    private static void expectFields(SseEventType type, JsonNode payload, String... fields) {
        if (!payload.isObject()) {
            throw new EventDecodeException(type.wireName() + " payload must be an object");
        }
        Set<String> expected = Set.of(fields);
        for (String field : fields) {
            JsonNode value = payload.get(field);
            if (value == null || value.isNull()) {
                throw new EventDecodeException(type.wireName() + " payload is missing field '" + field + "'");
            }
        }
        for (Iterator<String> names = payload.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!expected.contains(name)) {
                throw new EventDecodeException(type.wireName() + " payload has unexpected field '" + name + "'");
            }
        }
    }

    /**
     * Builds each variant's payload node. Field order is fixed, so encodings are byte-stable.
     */
    private final class PayloadEncoder implements SseDataVisitor<JsonNode> {

        @Override
        public JsonNode visitApiVersion(ApiVersion event) {
            return mapper.valueToTree(event.version());
        }

        @Override
        public JsonNode visitBlockAdded(BlockAdded event) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("block_hash", mapper.valueToTree(event.blockHash()));
            payload.set("block", mapper.valueToTree(event.block()));
            return payload;
        }

        @Override
        public JsonNode visitDeployAccepted(DeployAccepted event) {
            ObjectNode payload = mapper.createObjectNode();
            ObjectNode deploy = mapper.valueToTree(event.deploy());
            payload.setAll(deploy);
            return payload;
        }

        @Override
        public JsonNode visitDeployProcessed(DeployProcessed event) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("deploy_hash", mapper.valueToTree(event.deployHash()));
            payload.set("account", mapper.valueToTree(event.account()));
            payload.set("timestamp", mapper.valueToTree(event.timestamp()));
            payload.set("ttl", mapper.valueToTree(event.ttl()));
            payload.set("dependencies", mapper.valueToTree(event.dependencies()));
            payload.set("block_hash", mapper.valueToTree(event.blockHash()));
            payload.set("execution_result", mapper.valueToTree(event.executionResult()));
            return payload;
        }

        @Override
        public JsonNode visitDeployExpired(DeployExpired event) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("deploy_hash", mapper.valueToTree(event.deployHash()));
            return payload;
        }

        @Override
        public JsonNode visitFault(Fault event) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("era_id", mapper.valueToTree(event.eraId()));
            payload.set("public_key", mapper.valueToTree(event.publicKey()));
            payload.set("timestamp", mapper.valueToTree(event.timestamp()));
            return payload;
        }

        @Override
        public JsonNode visitFinalitySignature(FinalitySignature event) {
            ObjectNode payload = mapper.createObjectNode();
            ObjectNode signature = mapper.valueToTree(event.inner());
            payload.setAll(signature);
            return payload;
        }

        @Override
        public JsonNode visitStep(Step event) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("era_id", mapper.valueToTree(event.eraId()));
            payload.set("execution_effect", mapper.valueToTree(event.executionEffect()));
            return payload;
        }
    }
}

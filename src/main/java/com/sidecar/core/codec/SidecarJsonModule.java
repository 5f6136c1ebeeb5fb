package com.sidecar.core.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.sidecar.core.model.BlockHash;
import com.sidecar.core.model.DeployHash;
import com.sidecar.core.model.Digest;
import com.sidecar.core.model.EraId;
import com.sidecar.core.model.HexBytes;
import com.sidecar.core.model.ProtocolVersion;
import com.sidecar.core.model.PublicKey;
import com.sidecar.core.model.Signature;
import com.sidecar.core.model.TimeDiff;
import com.sidecar.core.model.Timestamp;
import com.sidecar.core.model.TransferAddr;
import com.sidecar.core.model.Transform;
import com.sidecar.core.model.TransformKind;

import java.io.IOException;
import java.time.DateTimeException;
import java.util.HexFormat;
import java.util.Map;
import java.util.function.Function;

/**
 * Jackson bindings for the node's value types.
 * <p>
 * Hashes, keys, signatures and raw bytes are written as lowercase hex; timestamps, durations
 * and protocol versions as their canonical strings; era ids as plain numbers. This is the
 * only place hex text is turned back into binary values.
 */
public class SidecarJsonModule extends SimpleModule {

    public SidecarJsonModule() {
        super("SidecarJsonModule");
        addText(Digest.class, Digest::toHex, text -> new Digest(parseHex(text)));
        addText(HexBytes.class, HexBytes::toHex, text -> new HexBytes(parseHex(text)));
        addText(BlockHash.class, BlockHash::toHex, text -> new BlockHash(new Digest(parseHex(text))));
        addText(DeployHash.class, DeployHash::toHex, text -> new DeployHash(new Digest(parseHex(text))));
        addText(TransferAddr.class, TransferAddr::toFormattedString, SidecarJsonModule::parseTransferAddr);
        addText(PublicKey.class, PublicKey::toHex, text -> PublicKey.fromTaggedBytes(parseHex(text)));
        addText(Signature.class, Signature::toHex, text -> Signature.fromTaggedBytes(parseHex(text)));
        addText(Timestamp.class, Timestamp::toString, Timestamp::parse);
        addText(TimeDiff.class, TimeDiff::toString, TimeDiff::parse);
        addText(ProtocolVersion.class, ProtocolVersion::toString, ProtocolVersion::parse);
        addSerializer(EraId.class, new EraIdSerializer());
        addDeserializer(EraId.class, new EraIdDeserializer());
        addSerializer(Transform.class, new TransformSerializer());
        addDeserializer(Transform.class, new TransformDeserializer());
    }

    private <T> void addText(Class<T> type, Function<T, String> format, Function<String, T> parse) {
        addSerializer(type, new TextSerializer<>(type, format));
        addDeserializer(type, new TextDeserializer<>(type, parse));
    }

    private static byte[] parseHex(String text) {
        return HexFormat.of().parseHex(text);
    }

    private static TransferAddr parseTransferAddr(String text) {
        if (!text.startsWith(TransferAddr.PREFIX)) {
            throw new IllegalArgumentException("Transfer address must start with '" + TransferAddr.PREFIX + "'");
        }
        return new TransferAddr(new Digest(parseHex(text.substring(TransferAddr.PREFIX.length()))));
    }

    static final class TextSerializer<T> extends StdSerializer<T> {

        private final transient Function<T, String> format;

        TextSerializer(Class<T> type, Function<T, String> format) {
            super(type);
            this.format = format;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format.apply(value));
        }
    }

    static final class TextDeserializer<T> extends StdDeserializer<T> {

        private final transient Function<String, T> parse;

        TextDeserializer(Class<T> type, Function<String, T> parse) {
            super(type);
            this.parse = parse;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                return (T) ctxt.handleUnexpectedToken(handledType(), p);
            }
            String text = p.getText();
            try {
                return parse.apply(text);
            } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
                throw ctxt.weirdStringException(text, handledType(), e.getMessage());
            }
        }
    }

    static final class EraIdSerializer extends StdSerializer<EraId> {

        EraIdSerializer() {
            super(EraId.class);
        }

        @Override
        public void serialize(EraId value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeNumber(value.value());
        }
    }

    static final class EraIdDeserializer extends StdDeserializer<EraId> {

        EraIdDeserializer() {
            super(EraId.class);
        }

        @Override
        public EraId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_NUMBER_INT)) {
                return (EraId) ctxt.handleUnexpectedToken(EraId.class, p);
            }
            long value = p.getLongValue();
            try {
                return new EraId(value);
            } catch (IllegalArgumentException e) {
                throw ctxt.weirdNumberException(value, EraId.class, e.getMessage());
            }
        }
    }

    /**
     * Kinds without a value are written as a bare name, the others as
     * {@code {"<kind>": "<value>"}}.
     */
    static final class TransformSerializer extends StdSerializer<Transform> {

        TransformSerializer() {
            super(Transform.class);
        }

        @Override
        public void serialize(Transform value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value.kind().carriesValue()) {
                gen.writeStartObject();
                gen.writeStringField(value.kind().wireName(), value.value());
                gen.writeEndObject();
            } else {
                gen.writeString(value.kind().wireName());
            }
        }
    }

    static final class TransformDeserializer extends StdDeserializer<Transform> {

        TransformDeserializer() {
            super(Transform.class);
        }

        @Override
        public Transform deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (node.isTextual()) {
                TransformKind kind = kindOf(node.asText(), ctxt);
                if (kind.carriesValue()) {
                    return ctxt.reportInputMismatch(Transform.class, "Transform %s requires a value", kind.wireName());
                }
                return new Transform(kind, null);
            }
            if (node.isObject() && node.size() == 1) {
                Map.Entry<String, JsonNode> entry = node.fields().next();
                TransformKind kind = kindOf(entry.getKey(), ctxt);
                if (!kind.carriesValue() || !entry.getValue().isTextual()) {
                    return ctxt.reportInputMismatch(Transform.class,
                            "Transform %s must carry a string value", kind.wireName());
                }
                return Transform.of(kind, entry.getValue().asText());
            }
            return ctxt.reportInputMismatch(Transform.class, "Transform must be a name or a single-field object");
        }

        private static TransformKind kindOf(String name, DeserializationContext ctxt) throws IOException {
            return TransformKind.fromWireName(name)
                    .orElseThrow(() -> ctxt.weirdStringException(name, Transform.class, "unknown transform kind"));
        }
    }
}

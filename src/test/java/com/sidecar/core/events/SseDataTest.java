package com.sidecar.core.events;

import com.sidecar.core.model.DeployHash;
import com.sidecar.core.model.Digest;
import com.sidecar.core.model.EraId;
import com.sidecar.core.model.KeyAlgorithm;
import com.sidecar.core.model.PublicKey;
import com.sidecar.core.model.Timestamp;
import com.sidecar.testing.RandomEvents;
import com.sidecar.testing.RandomModel;
import com.sidecar.testing.TestRng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the event variants and their correlation accessors.
 */
class SseDataTest {

    private final TestRng rng = new TestRng();

    @Nested
    @DisplayName("BlockAdded")
    class BlockAddedTests {

        @Test
        @DisplayName("height comes from the block header")
        void heightFromHeader() {
            var event = RandomEvents.blockAddedWithHeight(rng, 42);
            assertEquals(42, event.height(), rng.toString());
        }

        @Test
        @DisplayName("hex hash is stable and 64 characters")
        void hexHashStable() {
            var event = RandomEvents.blockAdded(rng);
            String first = event.hexEncodedHash();
            assertEquals(first, event.hexEncodedHash());
            assertEquals(64, first.length());
            assertEquals(first.toLowerCase(), first);
        }

        @Test
        @DisplayName("explicit hash overrides the block's own")
        void withHash() {
            String hex = "ab".repeat(32);
            var event = RandomEvents.blockAddedWithHash(rng, hex);
            assertEquals(hex, event.hexEncodedHash());
        }
    }

    @Nested
    @DisplayName("Deploy events")
    class DeployEventTests {

        @Test
        @DisplayName("DeployExpired hex of 0x01 followed by zeros")
        void deployExpiredHex() {
            byte[] bytes = new byte[32];
            bytes[0] = 0x01;
            var event = new DeployExpired(new DeployHash(new Digest(bytes)));
            assertEquals("01" + "00".repeat(31), event.hexEncodedHash());
        }

        @Test
        @DisplayName("DeployAccepted holds the same deploy instance")
        void deployAcceptedShares() {
            var deploy = RandomModel.deploy(rng);
            var first = new DeployAccepted(deploy);
            var second = new DeployAccepted(deploy);
            assertSame(first.deploy(), second.deploy());
            assertEquals(deploy.id(), first.deployHash());
            assertEquals(deploy.id().toHex(), first.hexEncodedHash());
        }

        @Test
        @DisplayName("DeployProcessed keeps dependency order and duplicates")
        void dependencyOrder() {
            var a = RandomModel.deployHash(rng);
            var b = RandomModel.deployHash(rng);
            var source = new ArrayList<>(List.of(b, a, b));
            var template = RandomEvents.deployProcessed(rng);

            var event = new DeployProcessed(template.deployHash(), template.account(), template.timestamp(),
                    template.ttl(), source, template.blockHash(), template.executionResult());
            source.clear();

            assertEquals(List.of(b, a, b), event.dependencies());
            assertThrows(UnsupportedOperationException.class, () -> event.dependencies().add(a));
        }

        @Test
        @DisplayName("DeployProcessed honours an explicit deploy hash")
        void deployProcessedOverride() {
            var hash = RandomModel.deployHash(rng);
            assertEquals(hash, RandomEvents.deployProcessed(rng, Optional.of(hash)).deployHash());
            assertEquals(hash.toHex(), RandomEvents.deployExpired(rng, Optional.of(hash)).hexEncodedHash());
        }
    }

    @Nested
    @DisplayName("FinalitySignature and Fault")
    class SignatureAndFaultTests {

        @Test
        @DisplayName("finality signature exposes block hash and key hex independently")
        void finalitySignatureHex() {
            var event = RandomEvents.finalitySignature(rng);
            assertEquals(event.inner().blockHash().toHex(), event.hexEncodedBlockHash());
            assertEquals(event.inner().publicKey().toHex(), event.hexEncodedPublicKey());
            int keyBytes = 1 + event.inner().publicKey().algorithm().publicKeyLength();
            assertEquals(2 * keyBytes, event.hexEncodedPublicKey().length());
            assertEquals(event.hexEncodedPublicKey(), event.hexEncodedPublicKey());
        }

        @Test
        @DisplayName("fault renders one field per line")
        void faultRendering() {
            var key = new PublicKey(KeyAlgorithm.ED25519, new byte[32]);
            var fault = new Fault(new EraId(12), key, new Timestamp(0));
            String rendered = fault.toString();

            assertEquals(List.of(
                    "Fault {",
                    "    era_id: 12,",
                    "    public_key: 01" + "00".repeat(32) + ",",
                    "    timestamp: 1970-01-01T00:00:00.000Z,",
                    "}"), rendered.lines().toList());
            assertEquals(rendered, fault.toString());
        }
    }

    @Nested
    @DisplayName("Taxonomy")
    class TaxonomyTests {

        @Test
        @DisplayName("each variant reports its own type")
        void variantTypes() {
            List<SseEventType> types = RandomEvents.everyVariant(rng).stream().map(SseData::type).toList();
            assertEquals(List.of(SseEventType.values()), types);
        }

        @Test
        @DisplayName("visitor dispatches to the matching method")
        void visitorDispatch() {
            SseDataVisitor<SseEventType> visitor = new SseDataVisitor<>() {
                public SseEventType visitApiVersion(ApiVersion e) { return SseEventType.API_VERSION; }
                public SseEventType visitBlockAdded(BlockAdded e) { return SseEventType.BLOCK_ADDED; }
                public SseEventType visitDeployAccepted(DeployAccepted e) { return SseEventType.DEPLOY_ACCEPTED; }
                public SseEventType visitDeployProcessed(DeployProcessed e) { return SseEventType.DEPLOY_PROCESSED; }
                public SseEventType visitDeployExpired(DeployExpired e) { return SseEventType.DEPLOY_EXPIRED; }
                public SseEventType visitFault(Fault e) { return SseEventType.FAULT; }
                public SseEventType visitFinalitySignature(FinalitySignature e) { return SseEventType.FINALITY_SIGNATURE; }
                public SseEventType visitStep(Step e) { return SseEventType.STEP; }
            };
            for (SseData event : RandomEvents.everyVariant(rng)) {
                assertEquals(event.type(), event.accept(visitor));
            }
        }

        @Test
        @DisplayName("wire names resolve back to their types")
        void wireNames() {
            for (SseEventType type : SseEventType.values()) {
                assertEquals(Optional.of(type), SseEventType.fromWireName(type.wireName()));
            }
            assertEquals(Optional.empty(), SseEventType.fromWireName("Shutdown"));
        }

        @Test
        @DisplayName("filters partition the non-handshake types")
        void filters() {
            Set<SseEventType> covered = EnumSet.noneOf(SseEventType.class);
            for (EventFilter filter : List.of(EventFilter.MAIN, EventFilter.DEPLOYS, EventFilter.SIGNATURES)) {
                for (SseEventType type : SseEventType.values()) {
                    if (filter.accepts(type)) {
                        assertTrue(covered.add(type), type + " is in more than one filter");
                        assertTrue(EventFilter.ALL.accepts(type));
                    }
                }
            }
            assertEquals(EnumSet.complementOf(EnumSet.of(SseEventType.API_VERSION)), covered);
            assertFalse(EventFilter.ALL.accepts(SseEventType.API_VERSION));
            assertEquals(Optional.of(EventFilter.SIGNATURES), EventFilter.fromPath("sigs"));
        }
    }
}

package com.acme.pubsub.core;

import com.acme.pubsub.test.AuthorRenamed;
import com.acme.pubsub.test.MediaDeleted;
import com.acme.pubsub.test.PriceUpdated;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec(new ValueCodec());

    record Reading(byte level, char grade, Character initial, double score) implements Channel {}

    @Test
    void testEncodeIdAndDate() {
        RecordContract<MediaDeleted> contract = RecordContract.of(MediaDeleted.class);

        String payload = codec.encode(new MediaDeleted(7, LocalDate.of(2024, 1, 1)), contract);

        JsonNode kwargs = Jsons.readObject(payload).get("kwargs");
        assertEquals(7, kwargs.get("id").intValue());
        assertEquals("2024-01-01", kwargs.get("date").textValue());
    }

    @Test
    void testDecodeIdAndDate() {
        RecordContract<MediaDeleted> contract = RecordContract.of(MediaDeleted.class);

        MediaDeleted decoded = codec.decodeChannel("{\"kwargs\": {\"id\": 7, \"date\": \"2024-01-01\"}}", contract);

        assertEquals(new MediaDeleted(7, LocalDate.of(2024, 1, 1)), decoded);
    }

    @Test
    void testContainersDecimalsAndEnumsSurvive() {
        RecordContract<PriceUpdated> contract = RecordContract.of(PriceUpdated.class);
        Map<String, Integer> stock = new LinkedHashMap<>();
        stock.put("ams", 3);
        stock.put("ber", 0);
        UUID batch = UUID.fromString("6f1c5c1e-7b55-4a47-9a43-2d0e3f1a9b10");
        PriceUpdated sent = new PriceUpdated(
            "SKU-1",
            new BigDecimal("19.990"),
            stock,
            List.of(Instant.parse("2024-03-01T10:15:30Z"), Instant.parse("2024-03-02T00:00:00.123Z")),
            Set.of(batch),
            PriceUpdated.Tier.PREMIUM
        );

        String payload = codec.encode(sent, contract);
        PriceUpdated received = codec.decodeChannel(payload, contract);

        assertTrue(payload.contains("19.990"));
        assertEquals(0, new BigDecimal("19.990").compareTo(received.price()));
        assertEquals(stock, received.stock());
        assertEquals(sent.seenAt(), received.seenAt());
        assertEquals(Set.of(batch), received.batches());
        assertEquals(PriceUpdated.Tier.PREMIUM, received.tier());
    }

    @Test
    void testDecimalIsNotRoundedThroughDouble() {
        RecordContract<PriceUpdated> contract = RecordContract.of(PriceUpdated.class);

        PriceUpdated received = codec.decodeChannel(
            "{\"kwargs\": {\"sku\": \"a\", \"price\": 0.1000000000000000055511151231257827, \"stock\": {},"
                + " \"seenAt\": [], \"batches\": [], \"tier\": \"STANDARD\"}}", contract);

        assertEquals("0.1000000000000000055511151231257827", received.price().toPlainString());
    }

    @Test
    void testMissingRequiredFieldFails() {
        RecordContract<MediaDeleted> contract = RecordContract.of(MediaDeleted.class);

        PayloadDecodeException e = assertThrows(PayloadDecodeException.class,
            () -> codec.decodeChannel("{\"kwargs\": {\"id\": 7}}", contract));
        assertTrue(e.getMessage().contains("date"));
    }

    @Test
    void testMissingOptionalAndNullableFields() {
        RecordContract<AuthorRenamed> contract = RecordContract.of(AuthorRenamed.class);

        AuthorRenamed decoded = codec.decodeChannel("{\"kwargs\": {\"authorId\": 3, \"name\": \"Ann\"}}", contract);

        assertEquals(3, decoded.authorId());
        assertEquals(Optional.empty(), decoded.previousName());
        assertNull(decoded.reason());
    }

    @Test
    void testUnknownKwargsAreIgnored() {
        RecordContract<MediaDeleted> contract = RecordContract.of(MediaDeleted.class);

        MediaDeleted decoded = codec.decodeChannel(
            "{\"kwargs\": {\"id\": 1, \"date\": \"2024-02-29\", \"removedField\": true}}", contract);

        assertEquals(LocalDate.of(2024, 2, 29), decoded.date());
    }

    @Test
    void testMalformedPayloads() {
        RecordContract<MediaDeleted> contract = RecordContract.of(MediaDeleted.class);

        assertThrows(PayloadDecodeException.class, () -> codec.decodeChannel("not json", contract));
        assertThrows(PayloadDecodeException.class, () -> codec.decodeChannel("{\"id\": 1}", contract));
        assertThrows(PayloadDecodeException.class,
            () -> codec.decodeChannel("{\"kwargs\": {\"id\": \"seven\", \"date\": \"2024-01-01\"}}", contract));
        assertThrows(PayloadDecodeException.class,
            () -> codec.decodeChannel("{\"kwargs\": {\"id\": 7, \"date\": \"yesterday\"}}", contract));
    }

    @Test
    void testFractionalOrOverflowingIntegersFail() {
        RecordContract<MediaDeleted> contract = RecordContract.of(MediaDeleted.class);

        assertThrows(PayloadDecodeException.class,
            () -> codec.decodeChannel("{\"kwargs\": {\"id\": 7.9, \"date\": \"2024-01-01\"}}", contract));
        assertThrows(PayloadDecodeException.class,
            () -> codec.decodeChannel("{\"kwargs\": {\"id\": 92233720368547758070, \"date\": \"2024-01-01\"}}", contract));
        assertEquals(7, codec.decodeChannel("{\"kwargs\": {\"id\": 7.0, \"date\": \"2024-01-01\"}}", contract).id());
    }

    @Test
    void testByteAndCharSurvive() {
        RecordContract<Reading> contract = RecordContract.of(Reading.class);
        Reading sent = new Reading((byte) 5, 'x', 'Q', 0.5);

        Reading decoded = codec.decodeChannel(codec.encode(sent, contract), contract);

        assertEquals(sent, decoded);
        assertThrows(PayloadDecodeException.class, () -> codec.decodeChannel(
            "{\"kwargs\": {\"level\": 300, \"grade\": \"x\", \"initial\": \"Q\", \"score\": 1}}", contract));
        assertThrows(PayloadDecodeException.class, () -> codec.decodeChannel(
            "{\"kwargs\": {\"level\": 1, \"grade\": \"xy\", \"initial\": \"Q\", \"score\": 1}}", contract));
    }

    @Test
    void testNonFiniteFloatsAreRejected() {
        RecordContract<Reading> contract = RecordContract.of(Reading.class);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> codec.encode(new Reading((byte) 1, 'a', null, Double.NaN), contract));
        assertTrue(e.getMessage().contains("NaN"));
        assertThrows(IllegalArgumentException.class,
            () -> codec.encode(new Reading((byte) 1, 'a', null, Double.POSITIVE_INFINITY), contract));
    }
}

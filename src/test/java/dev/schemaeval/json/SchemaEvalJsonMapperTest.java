package dev.schemaeval.json;

import static org.junit.jupiter.api.Assertions.*;

import dev.schemaeval.run.MockItem;
import dev.schemaeval.run.RunStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SchemaEvalJsonMapperTest {
    record Sample(String runName, Instant createdAt, Optional<String> failureReason) {}

    record StatusHolder(RunStatus status) {}

    @Test
    void writesSnakeCaseIsoDatesAndSkipsAbsent() throws Exception {
        var json =
                SchemaEvalJsonMapper.get()
                        .writeValueAsString(
                                new Sample(
                                        "nightly",
                                        Instant.parse("2024-01-02T03:04:05Z"),
                                        Optional.empty()));
        assertEquals("{\"run_name\":\"nightly\",\"created_at\":\"2024-01-02T03:04:05Z\"}", json);
    }

    @Test
    void readsCaseInsensitiveEnumsAndIgnoresUnknownFields() throws Exception {
        var holder =
                SchemaEvalJsonMapper.get()
                        .readValue("{\"status\":\"running\",\"extra\":1}", StatusHolder.class);
        assertEquals(RunStatus.RUNNING, holder.status());
    }

    @Test
    void itemDocumentsKeepDecimalsExact() throws Exception {
        var item =
                SchemaEvalJsonMapper.get()
                        .readValue(
                                "{\"id\":\"item-1\",\"content\":{\"price\":0.10,\"huge\":1e309}}",
                                MockItem.class);
        assertEquals(
                0, new BigDecimal("0.10").compareTo(item.content().get("price").decimalValue()));
        assertTrue(item.content().get("huge").isBigDecimal());
    }
}

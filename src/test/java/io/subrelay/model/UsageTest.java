package io.subrelay.model;

import io.subrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class UsageTest {

    @Test
    void accumulatesTurnsAndFormats() throws Exception {
        Usage usage = new Usage();
        usage.addTurn(Jsons.mapper().readTree(
                "{\"input\":1000,\"output\":500,\"cacheRead\":5000,\"cacheWrite\":1000,\"cost\":{\"total\":0.0100}}"));
        usage.addTurn(Jsons.mapper().readTree("{\"input\":200,\"output\":300,\"cost\":{\"total\":0.0023}}"));

        Assertions.assertEquals(2, usage.turns());
        Assertions.assertEquals(1200L, usage.inputTokens());
        Assertions.assertEquals("2 turns in:1.2k out:800 R5.0k W1.0k $0.0123 model-x", usage.format("model-x"));
    }

    @Test
    void turnWithoutUsageStillCounts() {
        Usage usage = new Usage();
        usage.addTurn(null);
        Assertions.assertEquals(1, usage.turns());
        Assertions.assertEquals("1 turn", usage.format(null));
    }

    @Test
    void tokenFormatting() {
        Assertions.assertEquals("999", Usage.formatTokens(999));
        Assertions.assertEquals("9.9k", Usage.formatTokens(9_900));
        Assertions.assertEquals("12k", Usage.formatTokens(12_400));
    }
}

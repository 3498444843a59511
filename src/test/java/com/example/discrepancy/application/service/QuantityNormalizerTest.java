package com.example.discrepancy.application.service;

import com.example.discrepancy.domain.model.NormalizedQuantity;
import com.example.discrepancy.infrastructure.config.DiscrepancyProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for quantity normalization with the default unit tokens.
 */
class QuantityNormalizerTest {

    private final QuantityNormalizer normalizer = new QuantityNormalizer(new DiscrepancyProperties().getUnitTokens());

    @Test
    void stripsUnitAndAcceptsCommaOrDotSeparator() {
        assertThat(normalizer.normalize("80 М3")).isEqualTo(new NormalizedQuantity.Parsed(80.0));
        assertThat(normalizer.normalize("80,0 М3")).isEqualTo(new NormalizedQuantity.Parsed(80.0));
        assertThat(normalizer.normalize("934 КГ")).isEqualTo(new NormalizedQuantity.Parsed(934.0));
        assertThat(normalizer.normalize("12,5 шт")).isEqualTo(new NormalizedQuantity.Parsed(12.5));
    }

    @Test
    void plainNumbersPassThrough() {
        assertThat(normalizer.normalize("358")).isEqualTo(new NormalizedQuantity.Parsed(358.0));
        assertThat(normalizer.normalize("0.75")).isEqualTo(new NormalizedQuantity.Parsed(0.75));
        assertThat(normalizer.normalize(506.0)).isEqualTo(new NormalizedQuantity.Parsed(506.0));
        assertThat(normalizer.normalize(42)).isEqualTo(new NormalizedQuantity.Parsed(42.0));
    }

    @Test
    void removesUnitsWrittenWithoutSpace() {
        assertThat(normalizer.normalize("12,5кг")).isEqualTo(new NormalizedQuantity.Parsed(12.5));
        assertThat(normalizer.normalize("3т")).isEqualTo(new NormalizedQuantity.Parsed(3.0));
    }

    @Test
    void removesEveryUnitToken() {
        assertThat(normalizer.normalize("5 т м3")).isEqualTo(new NormalizedQuantity.Parsed(5.0));
    }

    @Test
    void removesLatinUnitSpellings() {
        assertThat(normalizer.normalize("7.25 pcs")).isEqualTo(new NormalizedQuantity.Parsed(7.25));
        assertThat(normalizer.normalize("3 KG")).isEqualTo(new NormalizedQuantity.Parsed(3.0));
        assertThat(normalizer.normalize("40m3")).isEqualTo(new NormalizedQuantity.Parsed(40.0));
    }

    @Test
    void missingStaysMissing() {
        assertThat(normalizer.normalize(null)).isEqualTo(NormalizedQuantity.Missing.INSTANCE);
        assertThat(normalizer.normalize(null).toDouble()).isNaN();
    }

    @Test
    void unparseableTextIsReturnedUnchanged() {
        NormalizedQuantity result = normalizer.normalize("invalid");

        assertThat(result).isEqualTo(new NormalizedQuantity.Unparsed("invalid"));
        assertThat(result.toDouble()).isNaN();
        assertThat(normalizer.normalize("-")).isEqualTo(new NormalizedQuantity.Unparsed("-"));
    }

    @Test
    void unparsedKeepsOriginalBeforeCleanup() {
        assertThat(normalizer.normalize("12,5 КГ брутто")).isEqualTo(new NormalizedQuantity.Unparsed("12,5 КГ брутто"));
    }

    @Test
    void nonFiniteAndJavaSpecificLiteralsAreNotNumbers() {
        assertThat(normalizer.normalize("Infinity")).isInstanceOf(NormalizedQuantity.Unparsed.class);
        assertThat(normalizer.normalize("NaN")).isInstanceOf(NormalizedQuantity.Unparsed.class);
        assertThat(normalizer.normalize("1e400")).isInstanceOf(NormalizedQuantity.Unparsed.class);
        assertThat(normalizer.normalize("10d")).isInstanceOf(NormalizedQuantity.Unparsed.class);
        assertThat(normalizer.normalize(Double.POSITIVE_INFINITY)).isInstanceOf(NormalizedQuantity.Unparsed.class);
    }

    @Test
    void usesConfiguredTokensOnly() {
        QuantityNormalizer litres = new QuantityNormalizer(List.of("L"));

        assertThat(litres.normalize("10 L")).isEqualTo(new NormalizedQuantity.Parsed(10.0));
        assertThat(litres.normalize("10 КГ")).isEqualTo(new NormalizedQuantity.Unparsed("10 КГ"));
    }
}

package com.barthel.biasadjust.domain.model;

import com.barthel.biasadjust.domain.exception.KindNotSupportedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KindTest {

    @ParameterizedTest
    @ValueSource(strings = {"+", "add", "additive", " ADD "})
    void additiveAliases(String alias) {
        assertThat(Kind.fromAlias(alias)).isEqualTo(Kind.ADDITIVE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"*", "mult", "multiplicative"})
    void multiplicativeAliases(String alias) {
        assertThat(Kind.fromAlias(alias)).isEqualTo(Kind.MULTIPLICATIVE);
    }

    @Test
    void unknownAliasIsRejected() {
        assertThatThrownBy(() -> Kind.fromAlias("/"))
                .isInstanceOf(KindNotSupportedException.class)
                .hasMessageContaining("kind='/'")
                .hasMessageContaining("[+, *]");
        assertThatThrownBy(() -> Kind.fromAlias(null))
                .isInstanceOf(KindNotSupportedException.class);
    }
}

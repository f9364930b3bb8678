package com.ryuqq.artledger.core.config;

import com.ryuqq.artledger.core.model.Identity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CollectionConfig 테스트.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
class CollectionConfigTest {

    @Test
    void defaults() {
        CollectionConfig config = new CollectionConfig();

        assertThat(config.name()).isEqualTo("AI Artwork");
        assertThat(config.symbol()).isEqualTo("AIART");
        assertThat(config.digestAlgorithm()).isEqualTo("SHA3-256");
        assertThat(config.ledgerIdentity().toHex()).isEqualTo("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    }

    @Test
    void withName_ReturnsCopyWithOtherFieldsKept() {
        CollectionConfig base = new CollectionConfig();

        CollectionConfig renamed = base.withName("Gallery").withSymbol("GAL");

        assertThat(renamed.name()).isEqualTo("Gallery");
        assertThat(renamed.symbol()).isEqualTo("GAL");
        assertThat(renamed.description()).isEqualTo(base.description());
        assertThat(base.name()).isEqualTo("AI Artwork");
    }

    @Test
    void description_WithControlCharacter_ThrowsException() {
        assertThatThrownBy(() -> new CollectionConfig().withDescription("line1\nline2"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("control characters");
    }

    @Test
    void description_WithQuotes_IsAccepted() {
        assertThat(new CollectionConfig().withDescription("\"quoted\" \\ text").description())
            .isEqualTo("\"quoted\" \\ text");
    }

    @Test
    void ledgerIdentity_Null_ThrowsException() {
        assertThatThrownBy(() -> new CollectionConfig().withLedgerIdentity(Identity.NULL))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CollectionConfig().withLedgerIdentity(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankNameOrSymbol_ThrowsException() {
        assertThatThrownBy(() -> new CollectionConfig().withName(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CollectionConfig().withSymbol(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

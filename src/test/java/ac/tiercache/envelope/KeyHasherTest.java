package ac.tiercache.envelope;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeyHasherTest {

    @Test
    void testFileNameIsThirtyTwoLowercaseHex() {
        assertThat(KeyHasher.fileName("TIERCACHE:user:42")).matches("^[0-9a-f]{32}$");
    }

    @Test
    void testHashesAreStableAndKeySensitive() {
        assertThat(KeyHasher.fileName("a")).isEqualTo(KeyHasher.fileName("a"));
        assertThat(KeyHasher.fileName("a")).isNotEqualTo(KeyHasher.fileName("b"));
        assertThat(KeyHasher.keyTag("a")).isEqualTo(KeyHasher.keyTag("a"));
        assertThat(KeyHasher.keyTag("a")).isNotEqualTo(KeyHasher.keyTag("b"));
        assertThat(KeyHasher.narrowHash("a")).isEqualTo(KeyHasher.narrowHash("a"));
    }
}

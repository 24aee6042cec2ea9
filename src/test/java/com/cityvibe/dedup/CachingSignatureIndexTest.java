package com.cityvibe.dedup;

import com.cityvibe.persistence.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingSignatureIndex Tests")
class CachingSignatureIndexTest {

    @Mock
    private EventStore eventStore;

    private CachingSignatureIndex index;

    @BeforeEach
    void setUp() {
        index = new CachingSignatureIndex(eventStore, 100, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should cache signatures found in the store")
    void shouldCacheHits() {
        when(eventStore.findIdBySignature("sig-1")).thenReturn(Optional.of("evt-1"));

        assertThat(index.lookup("sig-1")).contains("evt-1");
        assertThat(index.lookup("sig-1")).contains("evt-1");

        verify(eventStore, times(1)).findIdBySignature("sig-1");
        assertThat(index.getCacheStats().hitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ask the store again after a miss")
    void shouldNotCacheMisses() {
        when(eventStore.findIdBySignature("sig-2"))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of("evt-2"));

        assertThat(index.lookup("sig-2")).isEmpty();
        assertThat(index.lookup("sig-2")).contains("evt-2");

        verify(eventStore, times(2)).findIdBySignature("sig-2");
    }

    @Test
    @DisplayName("Should serve appended signatures without touching the store")
    void shouldServeAppendedSignatures() {
        index.append("sig-3", "evt-3");

        assertThat(index.lookup("sig-3")).contains("evt-3");
        verify(eventStore, never()).findIdBySignature("sig-3");
    }
}

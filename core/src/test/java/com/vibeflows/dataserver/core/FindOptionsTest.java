package com.vibeflows.dataserver.core;

import com.mongodb.client.model.Sorts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FindOptionsTest {

    @Test
    void defaults_shouldReturnOneHundredFromTheStart() {
        FindOptions options = FindOptions.defaults();

        assertEquals(100, options.limit());
        assertEquals(0, options.skip());
        assertNull(options.sort());
    }

    @Test
    void limit_shouldBeCappedAtOneThousand() {
        assertEquals(1000, FindOptions.defaults().withLimit(5000).limit());
    }

    @Test
    void negativeSkip_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> FindOptions.defaults().withSkip(-1));
    }

    @Test
    void zeroLimit_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> FindOptions.defaults().withLimit(0));
    }

    @Test
    void withers_shouldKeepTheOtherFields() {
        FindOptions options = FindOptions.defaults()
                .withSort(Sorts.descending("created_at"))
                .withSkip(20)
                .withLimit(10);

        assertEquals(10, options.limit());
        assertEquals(20, options.skip());
        assertNotNull(options.sort());
    }
}

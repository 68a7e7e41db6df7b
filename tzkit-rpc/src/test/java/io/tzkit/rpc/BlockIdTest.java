// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import static org.junit.jupiter.api.Assertions.*;

import io.tzkit.core.error.InvalidIdentifierException;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class BlockIdTest {

    @Test
    void levelRendersAsDecimal() {
        assertEquals("523", BlockId.level(523L).toPathSegment());
        assertEquals("0", BlockId.level(0L).toPathSegment());
    }

    @Test
    void hashRendersUnchanged() {
        String hash = "BLockGenesisGenesisGenesisGenesisGenesisf79b5d1CoW2";
        assertEquals(hash, BlockId.hash(hash).toPathSegment());
    }

    @Test
    void resolvesIntegerTypes() {
        assertEquals("699577", BlockId.from(699577).toPathSegment());
        assertEquals("699577", BlockId.from(699577L).toPathSegment());
        assertEquals("12", BlockId.from((short) 12).toPathSegment());
        assertEquals("7", BlockId.from((byte) 7).toPathSegment());
        assertEquals("123456789012345678901234567890",
                BlockId.from(new BigInteger("123456789012345678901234567890")).toPathSegment());
    }

    @Test
    void negativeLevelsPassThrough() {
        assertEquals("-1", BlockId.from(-1).toPathSegment());
    }

    @Test
    void resolvesStringsAsHashes() {
        BlockId id = BlockId.from("BLrUoUTUqBiDEmXcqRdmRb2Nv4hmuxwFhMD8aPkAUbSq3zsfkZ6");
        assertInstanceOf(BlockId.Hash.class, id);
        assertEquals("BLrUoUTUqBiDEmXcqRdmRb2Nv4hmuxwFhMD8aPkAUbSq3zsfkZ6", id.toPathSegment());

        assertEquals("head", BlockId.from("head").toPathSegment());
    }

    @Test
    void returnsExistingBlockId() {
        BlockId id = BlockId.level(5L);
        assertSame(id, BlockId.from(id));
    }

    @Test
    void rejectsOtherTypes() {
        InvalidIdentifierException ex =
                assertThrows(InvalidIdentifierException.class, () -> BlockId.from(true));
        assertEquals("id must be a block level (integer) or a block hash (string), got Boolean", ex.getMessage());

        assertThrows(InvalidIdentifierException.class, () -> BlockId.from(1.5d));
        assertThrows(InvalidIdentifierException.class, () -> BlockId.from(2.0f));
        assertThrows(InvalidIdentifierException.class, () -> BlockId.from(new Object()));
    }

    @Test
    void rejectsNull() {
        InvalidIdentifierException ex =
                assertThrows(InvalidIdentifierException.class, () -> BlockId.from(null));
        assertTrue(ex.getMessage().endsWith("got null"));
    }

    @Test
    void stringsPassThroughWithoutTransformation() {
        assertEquals("", BlockId.from("").toPathSegment());
        assertEquals("   ", BlockId.from("   ").toPathSegment());
        assertEquals("head~2", BlockId.from("head~2").toPathSegment());
    }

    @Test
    void rejectsNullHash() {
        assertThrows(InvalidIdentifierException.class, () -> BlockId.hash(null));
    }
}

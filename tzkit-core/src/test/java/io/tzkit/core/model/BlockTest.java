// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import static org.junit.jupiter.api.Assertions.*;

import io.tzkit.core.model.operation.Endorsement;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockTest {

    private static BlockHeader header(long level) {
        return new BlockHeader(level, 5, "BLpred", "2019-11-21T09:33:58Z", 4, "LLo",
                List.of("01", "000000000009c2a0"), "CoV", 0, null, null, "sig");
    }

    private static OperationGroup group(String hash) {
        return new OperationGroup("PsBaby", "NetXdQprcVkpaWU", hash, "BLpred",
                List.of(new Endorsement(9L, null)), "sig");
    }

    @Test
    void copiesOperationsDefensively() {
        List<OperationGroup> pass = new ArrayList<>(List.of(group("oo1")));
        List<List<OperationGroup>> passes = new ArrayList<>();
        passes.add(pass);

        Block block = new Block("PsBaby", "NetXdQprcVkpaWU", "BLhash", header(10), null, passes);
        pass.add(group("oo2"));
        passes.add(List.of());

        assertEquals(1, block.operations().size());
        assertEquals(1, block.operations().get(0).size());
        assertThrows(UnsupportedOperationException.class, () -> block.operations().get(0).add(group("oo3")));
    }

    @Test
    void allOperationsConcatenatesPasses() {
        Block block = new Block("PsBaby", "NetXdQprcVkpaWU", "BLhash", header(10), null,
                List.of(List.of(group("oo1")), List.of(), List.of(group("oo2"), group("oo3"))));

        assertEquals(List.of("oo1", "oo2", "oo3"),
                block.allOperations().stream().map(OperationGroup::hash).toList());
        assertEquals(10L, block.level());
    }

    @Test
    void requiresIdentityFields() {
        assertThrows(NullPointerException.class,
                () -> new Block("PsBaby", "NetXdQprcVkpaWU", null, header(1), null, List.of()));
        assertThrows(NullPointerException.class,
                () -> new Block("PsBaby", "NetXdQprcVkpaWU", "BLhash", null, null, List.of()));
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc.internal;

import io.tzkit.core.InternalApi;

/**
 * Paths of the node RPC endpoints, relative to the RPC root.
 */
@InternalApi
public final class RpcPaths {

    public static final String BLOCKS = "/chains/main/blocks/";

    public static final String HEAD_BLOCK = BLOCKS + "head";

    private RpcPaths() {
        // Utility class - prevent instantiation
    }

    public static String block(final String segment) {
        return BLOCKS + segment;
    }

    public static String operationHashes(final String blockHash) {
        return BLOCKS + blockHash + "/operation_hashes";
    }
}

package io.ctxsync.server.dto;

import java.util.List;

/**
 * Optional JSON body for POST /admin/sync.
 * Example:
 *   { "contextIds": ["ctx-1", "ctx-2"] }
 * Without ids the pass covers every tracked context.
 */
public class SyncRequest {
    public List<String> contextIds;
}

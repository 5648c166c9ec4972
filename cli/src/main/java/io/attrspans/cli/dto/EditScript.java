package io.attrspans.cli.dto;

import java.util.List;

/**
 * JSON edit script replayed by the CLI.
 * Example:
 *   {
 *     "contentLength": 12,
 *     "operations": [
 *       {"op": "add", "attribution": {"type": "named", "name": "bold"}, "start": 0, "end": 4}
 *     ]
 *   }
 */
public class EditScript {
    public Integer contentLength;          // optional; required by "collapse" unless given on the command line
    public List<EditOperation> operations; // applied in order
}

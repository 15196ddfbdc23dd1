/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.minicluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.minicluster.exceptions.StatusFileParseException;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import static io.minicluster.JsonCodec.*;

/**
 * Codec for the status file a server writes into its data directory once it has bound its listeners.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "node_instance": { "permanent_uuid": "...", "instance_seqno": 1 },
 *   "bound_rpc_addresses": [ { "host": "127.0.0.1", "port": 41231 } ],
 *   "bound_http_addresses": [ { "host": "127.0.0.1", "port": 41232 } ]
 * }
 * </pre>
 */
public final class ServerStatusFile
{
    /**
     * Name of the status file within a server's data directory.
     */
    public static final String FILE_NAME = "info.json";

    /**
     * Format name passed to servers alongside the path of the status file.
     */
    public static final String FORMAT = "json";

    private ServerStatusFile()
    {
    }

    /**
     * Location of the status file within a data directory.
     *
     * @param dataDir of the server.
     * @return location of the status file.
     */
    public static File location(final File dataDir)
    {
        return new File(dataDir, FILE_NAME);
    }

    /**
     * Read and decode a status file.
     *
     * @param file to read.
     * @return the decoded status.
     * @throws StatusFileParseException if the file cannot be read or is not a valid status record.
     */
    public static ServerStatus read(final File file)
    {
        final JsonNode root;
        try
        {
            root = mapper().readTree(file);
        }
        catch (final IOException ex)
        {
            throw new StatusFileParseException("failed to read status file " + file, ex);
        }

        if (null == root || !root.isObject())
        {
            throw new StatusFileParseException("status file is not a JSON object: " + file);
        }

        try
        {
            final ServerStatus status = new ServerStatus(
                decodeNodeInstance(root.get(NODE_INSTANCE)),
                decodeHostPorts(root, BOUND_RPC_ADDRESSES),
                decodeHostPorts(root, BOUND_HTTP_ADDRESSES));

            if (status.boundRpcAddresses().isEmpty())
            {
                throw new IllegalArgumentException("no " + BOUND_RPC_ADDRESSES);
            }

            return status;
        }
        catch (final IllegalArgumentException ex)
        {
            throw new StatusFileParseException("invalid status file " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Encode and write a status file, replacing it atomically so a reader never sees a partial record.
     *
     * @param file   to write.
     * @param status to encode.
     */
    public static void write(final File file, final ServerStatus status)
    {
        final ObjectNode root = mapper().createObjectNode();
        root.set(NODE_INSTANCE, encode(status.nodeInstance()));
        root.set(BOUND_RPC_ADDRESSES, encode(status.boundRpcAddresses()));
        root.set(BOUND_HTTP_ADDRESSES, encode(status.boundHttpAddresses()));

        final File tmpFile = new File(file.getParentFile(), file.getName() + ".tmp");
        try
        {
            Files.write(tmpFile.toPath(), mapper().writeValueAsBytes(root));
            Files.move(tmpFile.toPath(), file.toPath(), StandardCopyOption.ATOMIC_MOVE);
        }
        catch (final JsonProcessingException ex)
        {
            throw new IllegalStateException("unable to encode " + status, ex);
        }
        catch (final IOException ex)
        {
            throw new UncheckedIOException("unable to write status file " + file, ex);
        }
    }
}

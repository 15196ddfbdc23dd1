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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON field names and conversions shared by the status file and the coordinator RPC messages.
 * <p>
 * Decoding is tolerant of unknown fields so servers may report more than the harness reads.
 */
public final class JsonCodec
{
    public static final String NODE_INSTANCE = "node_instance";
    public static final String PERMANENT_UUID = "permanent_uuid";
    public static final String INSTANCE_SEQNO = "instance_seqno";
    public static final String BOUND_RPC_ADDRESSES = "bound_rpc_addresses";
    public static final String BOUND_HTTP_ADDRESSES = "bound_http_addresses";
    public static final String HOST = "host";
    public static final String PORT = "port";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonCodec()
    {
    }

    /**
     * Shared mapper, thread safe once configured.
     *
     * @return the shared mapper.
     */
    public static ObjectMapper mapper()
    {
        return MAPPER;
    }

    /**
     * Encode an identity as an object with uuid and sequence number fields.
     *
     * @param nodeInstance to encode.
     * @return the encoded object.
     */
    public static ObjectNode encode(final NodeInstance nodeInstance)
    {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put(PERMANENT_UUID, nodeInstance.permanentUuid());
        node.put(INSTANCE_SEQNO, nodeInstance.instanceSeqNo());

        return node;
    }

    /**
     * Encode endpoints as an array of host and port objects.
     *
     * @param hostPorts to encode.
     * @return the encoded array.
     */
    public static ArrayNode encode(final List<HostPort> hostPorts)
    {
        final ArrayNode array = MAPPER.createArrayNode();
        for (final HostPort hostPort : hostPorts)
        {
            array.addObject().put(HOST, hostPort.host()).put(PORT, hostPort.port());
        }

        return array;
    }

    /**
     * Decode an identity.
     *
     * @param node holding uuid and sequence number fields.
     * @return the decoded identity.
     * @throws IllegalArgumentException if a field is missing or of the wrong type.
     */
    public static NodeInstance decodeNodeInstance(final JsonNode node)
    {
        if (null == node || !node.isObject())
        {
            throw new IllegalArgumentException("missing " + NODE_INSTANCE);
        }

        final JsonNode uuid = node.get(PERMANENT_UUID);
        if (null == uuid || !uuid.isTextual())
        {
            throw new IllegalArgumentException("missing " + PERMANENT_UUID);
        }

        final JsonNode seqNo = node.get(INSTANCE_SEQNO);
        if (null == seqNo || !seqNo.canConvertToLong())
        {
            throw new IllegalArgumentException("missing " + INSTANCE_SEQNO);
        }

        return new NodeInstance(uuid.asText(), seqNo.asLong());
    }

    /**
     * Decode a named array of endpoints from an object.
     *
     * @param parent    object holding the array.
     * @param fieldName of the array.
     * @return the decoded endpoints, empty if the field is absent.
     * @throws IllegalArgumentException if an element is malformed.
     */
    public static List<HostPort> decodeHostPorts(final JsonNode parent, final String fieldName)
    {
        final JsonNode array = parent.get(fieldName);
        final List<HostPort> hostPorts = new ArrayList<>();
        if (null == array || array.isNull())
        {
            return hostPorts;
        }

        if (!array.isArray())
        {
            throw new IllegalArgumentException(fieldName + " is not an array");
        }

        for (final JsonNode element : array)
        {
            final JsonNode host = element.get(HOST);
            final JsonNode port = element.get(PORT);
            if (null == host || !host.isTextual() || null == port || !port.canConvertToInt())
            {
                throw new IllegalArgumentException("malformed endpoint in " + fieldName + ": " + element);
            }
            hostPorts.add(new HostPort(host.asText(), port.asInt()));
        }

        return hostPorts;
    }
}

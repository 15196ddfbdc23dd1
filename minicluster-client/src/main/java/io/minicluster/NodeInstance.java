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

import java.util.Objects;

import static org.agrona.Strings.isEmpty;

/**
 * Identity of one incarnation of a server.
 * <p>
 * The permanent uuid is assigned to a server's data directory and survives restarts. The instance sequence number
 * is increased each time the server starts afresh, so two instances with the same uuid but different sequence
 * numbers are different incarnations of the same server.
 */
public final class NodeInstance
{
    private final String permanentUuid;
    private final long instanceSeqNo;

    /**
     * Construct an identity.
     *
     * @param permanentUuid durable unique id of the server.
     * @param instanceSeqNo start sequence number of this incarnation.
     */
    public NodeInstance(final String permanentUuid, final long instanceSeqNo)
    {
        if (isEmpty(permanentUuid))
        {
            throw new IllegalArgumentException("permanent uuid must not be empty");
        }

        this.permanentUuid = permanentUuid;
        this.instanceSeqNo = instanceSeqNo;
    }

    public String permanentUuid()
    {
        return permanentUuid;
    }

    public long instanceSeqNo()
    {
        return instanceSeqNo;
    }

    /**
     * Is the other instance the same server, regardless of incarnation.
     *
     * @param other instance to compare with.
     * @return true if the permanent uuids match.
     */
    public boolean isSameServer(final NodeInstance other)
    {
        return null != other && permanentUuid.equals(other.permanentUuid);
    }

    /**
     * Is the other instance the same live incarnation of the same server.
     *
     * @param other instance to compare with.
     * @return true if both the permanent uuid and the instance sequence number match.
     */
    public boolean isSameIncarnation(final NodeInstance other)
    {
        return isSameServer(other) && instanceSeqNo == other.instanceSeqNo;
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (o == null || getClass() != o.getClass())
        {
            return false;
        }

        return isSameIncarnation((NodeInstance)o);
    }

    public int hashCode()
    {
        return Objects.hash(permanentUuid, instanceSeqNo);
    }

    public String toString()
    {
        return "NodeInstance{" +
            "permanentUuid='" + permanentUuid + '\'' +
            ", instanceSeqNo=" + instanceSeqNo +
            '}';
    }
}

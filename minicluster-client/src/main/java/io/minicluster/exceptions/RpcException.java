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
package io.minicluster.exceptions;

/**
 * A request to a server failed at the transport level or the server answered with an error.
 */
public class RpcException extends MiniClusterException
{
    private static final long serialVersionUID = 1820663960441870425L;

    /**
     * RPC exception with provided message.
     *
     * @param message to detail the exception.
     */
    public RpcException(final String message)
    {
        super(message);
    }

    /**
     * RPC exception with a detailed message and the underlying cause.
     *
     * @param message providing detail on the error.
     * @param cause   of the error.
     */
    public RpcException(final String message, final Throwable cause)
    {
        super(message, cause);
    }
}

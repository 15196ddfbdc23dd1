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
 * A server process started but exited before it reported its bound endpoints.
 */
public class ProcessExitedEarlyException extends MiniClusterException
{
    private static final long serialVersionUID = 2906751213950125731L;

    private final int exitCode;

    /**
     * Exited early exception for a named executable.
     *
     * @param executable which exited.
     * @param exitCode   reported by the operating system.
     */
    public ProcessExitedEarlyException(final String executable, final int exitCode)
    {
        super("process exited with rc=" + exitCode + ": " + executable);
        this.exitCode = exitCode;
    }

    /**
     * Exit code of the process.
     *
     * @return exit code of the process.
     */
    public int exitCode()
    {
        return exitCode;
    }
}

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
package io.minicluster.test.cluster;

import io.minicluster.ServerStatus;
import io.minicluster.ServerStatusFile;
import io.minicluster.exceptions.ProcessExitedEarlyException;
import io.minicluster.exceptions.StartupTimeoutException;
import io.minicluster.test.Deadline;
import io.minicluster.test.launcher.ManagedProcess;
import org.agrona.IoUtil;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.NanoClock;
import org.agrona.concurrent.SleepingMillisIdleStrategy;

import java.io.File;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static io.minicluster.test.launcher.ManagedProcess.NOT_EXITED;

/**
 * Waits for a freshly launched server to publish its status file, failing fast if the server exits first.
 */
public final class StartupProbe
{
    /**
     * Interval between checks for the status file.
     */
    public static final long POLL_INTERVAL_MS = 10;

    private static final Logger LOG = Logger.getLogger(StartupProbe.class.getName());

    private final NanoClock clock;
    private final IdleStrategy idleStrategy;
    private final long timeoutNs;

    /**
     * Create a probe which polls every {@link #POLL_INTERVAL_MS}.
     *
     * @param clock     for the deadline.
     * @param timeoutNs for the status file to appear.
     */
    public StartupProbe(final NanoClock clock, final long timeoutNs)
    {
        this(clock, new SleepingMillisIdleStrategy(POLL_INTERVAL_MS), timeoutNs);
    }

    /**
     * Create a probe.
     *
     * @param clock        for the deadline.
     * @param idleStrategy between checks.
     * @param timeoutNs    for the status file to appear.
     */
    public StartupProbe(final NanoClock clock, final IdleStrategy idleStrategy, final long timeoutNs)
    {
        this.clock = clock;
        this.idleStrategy = idleStrategy;
        this.timeoutNs = timeoutNs;
    }

    public long timeoutNs()
    {
        return timeoutNs;
    }

    /**
     * Remove a status file left by a previous incarnation so it is not mistaken for the next one.
     *
     * @param dataDir of the server.
     */
    public void prepare(final File dataDir)
    {
        IoUtil.deleteIfExists(ServerStatusFile.location(dataDir));
    }

    /**
     * Wait for the status file of a launched server and decode it.
     *
     * @param name    of the server for error messages.
     * @param process of the server.
     * @param dataDir of the server.
     * @return the status the server reported.
     * @throws ProcessExitedEarlyException if the process exits before writing the status file.
     * @throws StartupTimeoutException     if the status file does not appear in time, the process is killed.
     * @throws io.minicluster.exceptions.StatusFileParseException if the status file is invalid.
     */
    public ServerStatus awaitStatus(final String name, final ManagedProcess process, final File dataDir)
    {
        final Deadline deadline = Deadline.after(clock, timeoutNs);
        final File statusFile = ServerStatusFile.location(dataDir);

        idleStrategy.reset();
        while (!statusFile.exists())
        {
            final int exitCode = process.pollExit();
            if (NOT_EXITED != exitCode)
            {
                throw new ProcessExitedEarlyException(name, exitCode);
            }

            if (deadline.hasExpired())
            {
                process.terminate();
                throw new StartupTimeoutException(
                    "timed out after " + TimeUnit.NANOSECONDS.toMillis(timeoutNs) + "ms waiting for " + statusFile);
            }

            idleStrategy.idle();
        }

        final ServerStatus status = ServerStatusFile.read(statusFile);
        LOG.fine(() -> name + " reported " + status);

        return status;
    }
}

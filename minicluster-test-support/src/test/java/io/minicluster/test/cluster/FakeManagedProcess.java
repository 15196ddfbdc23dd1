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

import io.minicluster.HostPort;
import io.minicluster.NodeInstance;
import io.minicluster.ServerStatus;
import io.minicluster.ServerStatusFile;
import io.minicluster.rpc.WorkerEntry;
import io.minicluster.test.launcher.ManagedProcess;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static io.minicluster.HostPort.EPHEMERAL_PORT;

/**
 * Pretend server which behaves like a real one as far as the harness can observe: it binds the endpoints it is
 * asked for, picking ports when asked for port 0, writes its status file and registers with the coordinator when
 * it is a worker.
 */
public class FakeManagedProcess implements ManagedProcess
{
    public enum Behaviour
    {
        WRITE_STATUS,
        EXIT_EARLY,
        HANG,
        WRITE_GARBAGE
    }

    public static final int KILLED_EXIT_CODE = 137;
    public static final int EARLY_EXIT_CODE = 3;

    private static final String RPC_BIND_SUFFIX = "_rpc_bind_addresses=";
    private static final String WEB_PORT_SUFFIX = "_web_port=";
    private static final String DUMP_INFO_PATH = "--server_dump_info_path=";
    private static final String COORDINATOR_ADDRS = "--worker_coordinator_addrs=";
    private static final AtomicInteger NEXT_PORT = new AtomicInteger(30_000);
    private static final AtomicLong NEXT_PID = new AtomicLong(1_000);

    private final File dataDir;
    private final FakeCoordinatorRegistry registry;
    private final String permanentUuid = UUID.randomUUID().toString();
    private final List<String> executables = new ArrayList<>();
    private final List<List<String>> launches = new ArrayList<>();
    private Behaviour behaviour;
    private long instanceSeqNo = 0;
    private long pid = NULL_PID;
    private int exitCode = NOT_EXITED;
    private boolean isSuspended = false;
    private int terminateCount = 0;

    public FakeManagedProcess(final File dataDir, final FakeCoordinatorRegistry registry, final Behaviour behaviour)
    {
        this.dataDir = dataDir;
        this.registry = registry;
        this.behaviour = behaviour;
    }

    public void behaviour(final Behaviour behaviour)
    {
        this.behaviour = behaviour;
    }

    public void launch(final String executable, final List<String> args)
    {
        if (NULL_PID != pid)
        {
            throw new IllegalStateException("already launched");
        }

        executables.add(executable);
        launches.add(List.copyOf(args));
        pid = NEXT_PID.incrementAndGet();
        exitCode = NOT_EXITED;
        isSuspended = false;

        switch (behaviour)
        {
            case WRITE_STATUS:
                serve(args);
                break;

            case EXIT_EARLY:
                exitCode = EARLY_EXIT_CODE;
                break;

            case WRITE_GARBAGE:
                writeGarbage(args);
                break;

            case HANG:
                break;
        }
    }

    public boolean isLaunched()
    {
        return NULL_PID != pid;
    }

    public long pid()
    {
        return pid;
    }

    public void suspend()
    {
        if (isLaunched())
        {
            isSuspended = true;
        }
    }

    public void resume()
    {
        if (isLaunched())
        {
            isSuspended = false;
        }
    }

    public void terminate()
    {
        if (isLaunched())
        {
            terminateCount++;
            if (NOT_EXITED == exitCode)
            {
                exitCode = KILLED_EXIT_CODE;
            }
        }
    }

    public int waitFor()
    {
        if (!isLaunched())
        {
            throw new IllegalStateException("not launched");
        }

        if (NOT_EXITED == exitCode)
        {
            throw new IllegalStateException("fake process would block forever");
        }

        return exitCode;
    }

    public int pollExit()
    {
        if (!isLaunched())
        {
            throw new IllegalStateException("not launched");
        }

        return exitCode;
    }

    public void reset()
    {
        pid = NULL_PID;
        exitCode = NOT_EXITED;
        isSuspended = false;
    }

    public void crash(final int exitCode)
    {
        this.exitCode = exitCode;
    }

    public File dataDir()
    {
        return dataDir;
    }

    public String permanentUuid()
    {
        return permanentUuid;
    }

    public List<String> executables()
    {
        return executables;
    }

    public List<List<String>> launches()
    {
        return launches;
    }

    public List<String> lastArgs()
    {
        return launches.get(launches.size() - 1);
    }

    public boolean isSuspended()
    {
        return isSuspended;
    }

    public int terminateCount()
    {
        return terminateCount;
    }

    private void serve(final List<String> args)
    {
        final HostPort rpcAddress = bind(HostPort.parse(lastValue(args, RPC_BIND_SUFFIX)));
        final String webPort = lastValue(args, WEB_PORT_SUFFIX);
        final HostPort httpAddress = bind(
            HostPort.localhost(null == webPort ? EPHEMERAL_PORT : Integer.parseInt(webPort)));
        final NodeInstance instance = new NodeInstance(permanentUuid, ++instanceSeqNo);

        ServerStatusFile.write(
            new File(lastValue(args, DUMP_INFO_PATH)),
            new ServerStatus(instance, List.of(rpcAddress), List.of(httpAddress)));

        if (null != lastValue(args, COORDINATOR_ADDRS))
        {
            registry.register(new WorkerEntry(instance, List.of(rpcAddress), List.of(httpAddress), 0));
        }
    }

    private void writeGarbage(final List<String> args)
    {
        try
        {
            final File statusFile = new File(lastValue(args, DUMP_INFO_PATH));
            Files.write(statusFile.toPath(), "{not json".getBytes(StandardCharsets.UTF_8));
        }
        catch (final IOException ex)
        {
            throw new UncheckedIOException(ex);
        }
    }

    private static HostPort bind(final HostPort requested)
    {
        return EPHEMERAL_PORT == requested.port() ? new HostPort(requested.host(), NEXT_PORT.incrementAndGet()) :
            requested;
    }

    private static String lastValue(final List<String> args, final String flagSuffix)
    {
        String value = null;
        for (final String arg : args)
        {
            final int index = arg.indexOf(flagSuffix);
            if (arg.startsWith("--") && index >= 0)
            {
                value = arg.substring(index + flagSuffix.length());
            }
        }

        return value;
    }
}

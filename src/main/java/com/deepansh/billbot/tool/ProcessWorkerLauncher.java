package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.ToolProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Launches the tool worker as a child process from the configured command line.
 * The worker speaks line-delimited JSON-RPC on stdin/stdout and logs on stderr.
 */
@Slf4j
public class ProcessWorkerLauncher implements WorkerLauncher {

    private final ToolProperties.Worker props;

    public ProcessWorkerLauncher(ToolProperties.Worker props) {
        this.props = props;
    }

    @Override
    public WorkerProcess launch() throws IOException {
        List<String> command = props.getCommandTokens();
        if (command.isEmpty()) {
            throw new IOException("tools.worker.command is empty");
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        if (props.getWorkingDirectory() != null && !props.getWorkingDirectory().isBlank()) {
            pb.directory(new File(props.getWorkingDirectory()));
        }
        pb.redirectErrorStream(false);

        Process process = pb.start();
        log.info("Tool worker launched [pid={}, command={}]", process.pid(), command);
        return new OsWorkerProcess(process);
    }

    private static final class OsWorkerProcess implements WorkerProcess {

        private final Process process;
        private final CompletableFuture<Integer> exit;

        OsWorkerProcess(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override public OutputStream stdin() { return process.getOutputStream(); }
        @Override public InputStream stdout() { return process.getInputStream(); }
        @Override public InputStream stderr() { return process.getErrorStream(); }
        @Override public boolean isAlive() { return process.isAlive(); }
        @Override public CompletableFuture<Integer> onExit() { return exit; }
        @Override public void destroy() { process.destroy(); }
        @Override public void destroyForcibly() { process.destroyForcibly(); }
        @Override public long pid() { return process.pid(); }
    }
}

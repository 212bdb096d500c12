package com.deepansh.billbot.tool;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {

    WorkerProcess launch() throws IOException;
}

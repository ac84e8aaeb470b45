package com.vmsimulator.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Reading resident memory from a /proc-like directory tree.
 */
public class ProcessInspectorTest {

    @TempDir
    Path procRoot;

    private void writeStatus(long pid, String vmRss) throws IOException {
        Path dir = Files.createDirectories(procRoot.resolve(Long.toString(pid)));
        Files.writeString(dir.resolve("status"),
                "Name:\tjava\nState:\tS (sleeping)\nVmRSS:\t" + vmRss + "\nThreads:\t12\n",
                StandardCharsets.UTF_8);
    }

    @Test
    void testListsProcessWithStatus() throws IOException {
        long pid = ProcessHandle.current().pid();
        writeStatus(pid, "  204800 kB");

        List<ProcessInfo> processes = new ProcessInspector(procRoot).listProcesses();

        assertEquals(1, processes.size());
        assertEquals(pid, processes.get(0).getPid());
        assertEquals(200.0, processes.get(0).getMemoryMb(), 1e-9);
    }

    @Test
    void testSkipsSmallProcesses() throws IOException {
        writeStatus(ProcessHandle.current().pid(), "512 kB");

        assertTrue(new ProcessInspector(procRoot).listProcesses().isEmpty());
    }

    @Test
    void testParseVmRss() {
        assertEquals(1234L, ProcessInspector.parseVmRssKb(List.of("Name:\tx", "VmRSS:\t    1234 kB")).getAsLong());
        assertTrue(ProcessInspector.parseVmRssKb(List.of("Name:\tkthreadd")).isEmpty());
        assertTrue(ProcessInspector.parseVmRssKb(List.of("VmRSS:\tlots kB")).isEmpty());
    }
}

package com.vmsimulator.process;

/**
 * Proceso del sistema observado por {@link ProcessInspector}: pid, nombre y
 * memoria residente en MB.
 */
public final class ProcessInfo {
    private final long pid;
    private final String name;
    private final double memoryMb;

    public ProcessInfo(long pid, String name, double memoryMb) {
        this.pid = pid;
        this.name = name;
        this.memoryMb = memoryMb;
    }

    public long getPid() {
        return pid;
    }

    public String getName() {
        return name;
    }

    public double getMemoryMb() {
        return memoryMb;
    }

    @Override
    public String toString() {
        return String.format("%s (PID: %d) - %.1f MB", name, pid, memoryMb);
    }
}

package com.vmsimulator.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;

/**
 * ProcessInspector
 *
 * Lista procesos vivos mediante {@link ProcessHandle} y obtiene su memoria
 * residente de /proc/&lt;pid&gt;/status (campo VmRSS). En sistemas sin /proc
 * la lista queda vacía.
 */
public class ProcessInspector {
    /** Umbral mínimo de memoria para considerar un proceso relevante. */
    public static final double MIN_MEMORY_MB = 1.0;

    private final Path procRoot;

    /**
     * Inspector sobre el /proc del sistema.
     */
    public ProcessInspector() {
        this(Path.of("/proc"));
    }

    /**
     * @param procRoot directorio con la estructura &lt;pid&gt;/status
     */
    public ProcessInspector(Path procRoot) {
        this.procRoot = procRoot;
    }

    /**
     * Devuelve los procesos con más de {@link #MIN_MEMORY_MB} MB residentes,
     * ordenados por memoria descendente.
     *
     * @return lista de procesos (posiblemente vacía)
     */
    public List<ProcessInfo> listProcesses() {
        List<ProcessInfo> processes = new ArrayList<>();
        ProcessHandle.allProcesses().forEach(ph -> {
            OptionalLong rssKb = readResidentKb(ph.pid());
            if (rssKb.isEmpty()) {
                return;
            }
            double memoryMb = rssKb.getAsLong() / 1024.0;
            if (memoryMb > MIN_MEMORY_MB) {
                processes.add(new ProcessInfo(ph.pid(), processName(ph), memoryMb));
            }
        });
        processes.sort(Comparator.comparingDouble(ProcessInfo::getMemoryMb).reversed());
        return processes;
    }

    /**
     * Lee VmRSS del proceso. Un proceso que terminó o cuyo status no es
     * legible se trata como ausente.
     *
     * @param pid identificador del proceso
     * @return memoria residente en kB o vacío
     */
    OptionalLong readResidentKb(long pid) {
        Path status = procRoot.resolve(Long.toString(pid)).resolve("status");
        if (!Files.isReadable(status)) {
            return OptionalLong.empty();
        }
        try {
            return parseVmRssKb(Files.readAllLines(status, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Extrae el valor de la línea "VmRSS:   12345 kB".
     *
     * @param statusLines líneas de /proc/&lt;pid&gt;/status
     * @return kB residentes o vacío si no hay línea VmRSS válida
     */
    static OptionalLong parseVmRssKb(List<String> statusLines) {
        for (String line : statusLines) {
            if (!line.startsWith("VmRSS:")) {
                continue;
            }
            String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
            try {
                return OptionalLong.of(Long.parseLong(parts[0]));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private static String processName(ProcessHandle ph) {
        return ph.info().command()
                .map(c -> {
                    Path fileName = Path.of(c).getFileName();
                    return fileName != null ? fileName.toString() : c;
                })
                .orElse("pid-" + ph.pid());
    }
}

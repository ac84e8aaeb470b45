package com.vmsimulator;

import com.vmsimulator.gui.MainWindow;
import com.vmsimulator.memory.ReplacementPolicy;
import com.vmsimulator.simulator.SimulationConfig;
import com.vmsimulator.simulator.SimulationReport;
import com.vmsimulator.simulator.VirtualMemorySimulator;
import com.vmsimulator.util.ConfigParser;
import java.io.PrintStream;
import java.util.List;
import javax.swing.SwingUtilities;

/**
 * Punto de entrada.
 *
 * Sin argumentos abre la ventana principal. Con argumentos imprime el informe
 * en consola:
 * <pre>
 * Main &lt;frames&gt; &lt;sequence&gt; [LRU|OPTIMAL|BOTH]
 * </pre>
 */
public final class Main {
    static final String USAGE = "usage: Main <frames> <sequence> [LRU|OPTIMAL|BOTH]";

    private Main() {
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            SwingUtilities.invokeLater(() -> new MainWindow().setVisible(true));
            return;
        }
        int status = runConsole(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Ejecuta el modo consola.
     *
     * @param args argumentos de línea de comandos
     * @param out  salida del informe
     * @param err  salida de errores
     * @return código de salida (0 si todo fue bien)
     */
    static int runConsole(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2 || args.length > 3) {
            err.println(USAGE);
            return 1;
        }
        try {
            int frames = Integer.parseInt(args[0].trim());
            List<Integer> sequence = ConfigParser.parseSequence(args[1]);
            String mode = args.length == 3 ? args[2] : "BOTH";

            VirtualMemorySimulator simulator = new VirtualMemorySimulator();
            if ("BOTH".equalsIgnoreCase(mode.trim())) {
                out.print(SimulationReport.compare(simulator.compare(frames, sequence)));
            } else {
                SimulationConfig config = new SimulationConfig(frames, ReplacementPolicy.fromName(mode));
                out.print(SimulationReport.format(simulator.simulate(config, sequence)));
            }
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }
    }
}

package com.vmsimulator.gui;

import com.vmsimulator.memory.ReplacementPolicy;
import com.vmsimulator.memory.SimulationResult;
import com.vmsimulator.process.ExampleSequence;
import com.vmsimulator.process.PageSequenceGenerator;
import com.vmsimulator.process.ProcessInfo;
import com.vmsimulator.process.ProcessInspector;
import com.vmsimulator.simulator.SimulationConfig;
import com.vmsimulator.simulator.SimulationReport;
import com.vmsimulator.simulator.VirtualMemorySimulator;
import com.vmsimulator.util.ConfigParser;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Font;
import java.awt.GridLayout;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Random;
import javax.swing.*;

/**
 * MainWindow
 *
 * Ventana principal del simulador. Contiene:
 * - Panel de configuración: frames, política, secuencia de referencias y
 * fuentes de secuencia (ejemplos, procesos vivos, fichero).
 * - Panel visual: traza de frames por paso y métricas.
 *
 * Cada ejecución pasa por VirtualMemorySimulator, que crea un algoritmo nuevo;
 * la ventana solo conserva el último resultado mostrado.
 */
public class MainWindow extends JFrame {
    private static final long serialVersionUID = 1L;

    private final VirtualMemorySimulator simulator;
    private final ProcessInspector processInspector;
    private final Random random = new Random();

    private MemoryVisualizerPanel memoryPanel;
    private MetricsPanel metricsPanel;

    private JComboBox<ReplacementPolicy> policyCombo;
    private JComboBox<ExampleSequence> exampleCombo;
    private JComboBox<ProcessInfo> processCombo;
    private JSpinner memoryFramesSpinner;
    private JTextField sequenceField;
    private JTextArea logArea;
    private JButton runButton;
    private JButton compareButton;
    private JButton exampleButton;
    private JButton refreshProcessesButton;
    private JButton generateButton;
    private JButton loadButton;

    public MainWindow() {
        this(new VirtualMemorySimulator(), new ProcessInspector());
    }

    public MainWindow(VirtualMemorySimulator simulator, ProcessInspector processInspector) {
        this.simulator = simulator;
        this.processInspector = processInspector;

        setTitle("Virtual Memory Simulator");
        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setSize(1400, 900);
        setLocationRelativeTo(null);

        initComponents();
        layoutComponents();

        simulator.getEventLogger()
                .addListener(event -> SwingUtilities.invokeLater(() -> logArea.append(event + "\n")));
    }

    /**
     * Inicializa componentes UI y controles.
     */
    private void initComponents() {
        memoryPanel = new MemoryVisualizerPanel();
        metricsPanel = new MetricsPanel();

        policyCombo = new JComboBox<>(ReplacementPolicy.values());
        exampleCombo = new JComboBox<>(ExampleSequence.values());
        processCombo = new JComboBox<>();

        memoryFramesSpinner = new JSpinner(new SpinnerNumberModel(SimulationConfig.DEFAULT_FRAMES, 1, 20, 1));
        sequenceField = new JTextField();
        setSequence(ExampleSequence.BASIC.pages(random));

        logArea = new JTextArea();
        logArea.setEditable(false);
        logArea.setFont(new Font("Monospaced", Font.PLAIN, 11));

        runButton = new JButton("Run Simulation");
        runButton.addActionListener(e -> runSimulation());

        compareButton = new JButton("Compare LRU / Optimal");
        compareButton.addActionListener(e -> compareAlgorithms());

        exampleButton = new JButton("Use Example");
        exampleButton.addActionListener(e -> useExample());

        refreshProcessesButton = new JButton("Refresh Processes");
        refreshProcessesButton.addActionListener(e -> refreshProcesses());

        generateButton = new JButton("Generate From Process");
        generateButton.addActionListener(e -> generateFromProcess());

        loadButton = new JButton("Load Sequence");
        loadButton.addActionListener(e -> loadSequence());
    }

    /**
     * Construye el layout principal con panel de control y panel visual.
     */
    private void layoutComponents() {
        JPanel controlPanel = createControlPanel();
        JPanel visualPanel = createVisualPanel();

        JSplitPane mainSplit = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT, controlPanel, visualPanel);
        mainSplit.setDividerLocation(320);
        add(mainSplit);
    }

    /**
     * Crea el panel lateral de control con configuraciones y log de eventos.
     *
     * @return JPanel listo para colocarse en la ventana principal
     */
    private JPanel createControlPanel() {
        JPanel mainPanel = new JPanel(new BorderLayout());
        mainPanel.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
        mainPanel.setBackground(new Color(240, 240, 240));

        JPanel topPanel = new JPanel();
        topPanel.setLayout(new BoxLayout(topPanel, BoxLayout.Y_AXIS));
        topPanel.setBackground(new Color(240, 240, 240));

        JLabel configTitle = new JLabel("Memory Configuration");
        configTitle.setFont(new Font("Arial", Font.BOLD, 14));

        topPanel.add(configTitle);
        topPanel.add(Box.createVerticalStrut(10));
        topPanel.add(new JLabel("Memory Frames:"));
        topPanel.add(memoryFramesSpinner);
        topPanel.add(Box.createVerticalStrut(5));
        topPanel.add(new JLabel("Page Replacement:"));
        topPanel.add(policyCombo);
        topPanel.add(Box.createVerticalStrut(5));
        topPanel.add(new JLabel("Page Sequence (comma-separated):"));
        topPanel.add(sequenceField);
        topPanel.add(Box.createVerticalStrut(10));

        topPanel.add(new JLabel("Example:"));
        topPanel.add(exampleCombo);
        topPanel.add(exampleButton);
        topPanel.add(Box.createVerticalStrut(5));
        topPanel.add(new JLabel("Running Process:"));
        topPanel.add(processCombo);

        JPanel processButtons = new JPanel(new GridLayout(1, 2, 5, 5));
        processButtons.setBackground(new Color(240, 240, 240));
        processButtons.add(refreshProcessesButton);
        processButtons.add(generateButton);
        topPanel.add(processButtons);
        topPanel.add(Box.createVerticalStrut(10));

        JPanel buttonPanel = new JPanel(new GridLayout(3, 1, 5, 5));
        buttonPanel.setBackground(new Color(240, 240, 240));
        buttonPanel.add(loadButton);
        buttonPanel.add(runButton);
        buttonPanel.add(compareButton);

        topPanel.add(buttonPanel);
        topPanel.add(Box.createVerticalStrut(10));

        JPanel logPanel = new JPanel(new BorderLayout());
        JLabel logTitle = new JLabel("Event Log");
        logTitle.setFont(new Font("Arial", Font.BOLD, 14));
        logPanel.add(logTitle, BorderLayout.NORTH);
        logPanel.add(new JScrollPane(logArea), BorderLayout.CENTER);

        mainPanel.add(topPanel, BorderLayout.NORTH);
        mainPanel.add(logPanel, BorderLayout.CENTER);

        return mainPanel;
    }

    /**
     * Crea el panel visual con la traza de memoria y las métricas.
     *
     * @return JPanel con la vista principal del simulador
     */
    private JPanel createVisualPanel() {
        JPanel panel = new JPanel(new BorderLayout());
        panel.setBorder(BorderFactory.createEmptyBorder(5, 5, 5, 5));
        panel.add(memoryPanel, BorderLayout.CENTER);
        panel.add(metricsPanel, BorderLayout.EAST);
        return panel;
    }

    /**
     * Lee la secuencia del campo de texto. Muestra el error y devuelve null si no
     * es válida.
     */
    private List<Integer> readSequence() {
        try {
            List<Integer> sequence = ConfigParser.parseSequence(sequenceField.getText());
            if (sequence.isEmpty()) {
                JOptionPane.showMessageDialog(this, "Please enter at least one page number.", "Error",
                        JOptionPane.ERROR_MESSAGE);
                return null;
            }
            return sequence;
        } catch (IllegalArgumentException e) {
            JOptionPane.showMessageDialog(this,
                    "Please enter valid numbers separated by commas.\n" + e.getMessage(),
                    "Error",
                    JOptionPane.ERROR_MESSAGE);
            return null;
        }
    }

    private int selectedFrames() {
        return (int) memoryFramesSpinner.getValue();
    }

    /**
     * Ejecuta la política seleccionada y actualiza los paneles.
     */
    private void runSimulation() {
        List<Integer> sequence = readSequence();
        if (sequence == null) {
            return;
        }
        ReplacementPolicy policy = (ReplacementPolicy) policyCombo.getSelectedItem();
        SimulationResult result = simulator.simulate(new SimulationConfig(selectedFrames(), policy), sequence);
        memoryPanel.updateData(result);
        metricsPanel.updateMetrics(result);
    }

    /**
     * Ejecuta ambas políticas y vuelca el resumen en el log; los paneles muestran
     * la política seleccionada.
     */
    private void compareAlgorithms() {
        List<Integer> sequence = readSequence();
        if (sequence == null) {
            return;
        }
        Map<ReplacementPolicy, SimulationResult> results = simulator.compare(selectedFrames(), sequence);
        logArea.append(SimulationReport.compare(results));

        SimulationResult shown = results.get((ReplacementPolicy) policyCombo.getSelectedItem());
        memoryPanel.updateData(shown);
        metricsPanel.updateMetrics(shown);
    }

    private void useExample() {
        ExampleSequence example = (ExampleSequence) exampleCombo.getSelectedItem();
        setSequence(example.pages(random));
    }

    /**
     * Recarga la lista de procesos vivos.
     */
    private void refreshProcesses() {
        List<ProcessInfo> processes = processInspector.listProcesses();
        processCombo.setModel(new DefaultComboBoxModel<>(processes.toArray(new ProcessInfo[0])));
        if (processes.isEmpty()) {
            JOptionPane.showMessageDialog(this, "No process memory information available on this system.",
                    "Info", JOptionPane.INFORMATION_MESSAGE);
        }
    }

    /**
     * Genera una secuencia con localidad a partir del proceso seleccionado.
     */
    private void generateFromProcess() {
        ProcessInfo process = (ProcessInfo) processCombo.getSelectedItem();
        if (process == null) {
            JOptionPane.showMessageDialog(this, "No process selected. Refresh the process list first.", "Error",
                    JOptionPane.ERROR_MESSAGE);
            return;
        }
        setSequence(new PageSequenceGenerator(random).generate(process));
    }

    /**
     * Abre un selector de archivos para cargar una secuencia desde fichero.
     */
    private void loadSequence() {
        JFileChooser fileChooser = new JFileChooser();
        int result = fileChooser.showOpenDialog(this);

        if (result == JFileChooser.APPROVE_OPTION) {
            try {
                List<Integer> sequence = ConfigParser.parseSequenceFromFile(
                        fileChooser.getSelectedFile().getAbsolutePath());
                setSequence(sequence);
                JOptionPane.showMessageDialog(this,
                        "Loaded " + sequence.size() + " page references",
                        "Success",
                        JOptionPane.INFORMATION_MESSAGE);
            } catch (IOException e) {
                JOptionPane.showMessageDialog(this,
                        "Error loading file: " + e.getMessage(),
                        "Error",
                        JOptionPane.ERROR_MESSAGE);
            }
        }
    }

    private void setSequence(List<Integer> sequence) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sequence.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(sequence.get(i));
        }
        sequenceField.setText(sb.toString());
    }
}

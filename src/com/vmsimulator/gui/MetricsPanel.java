package com.vmsimulator.gui;

import com.vmsimulator.memory.SimulationResult;
import com.vmsimulator.simulator.SimulationReport;
import javax.swing.*;
import java.awt.*;

public class MetricsPanel extends JPanel {
    private JLabel algorithmLabel;
    private JLabel pageFaultsLabel;
    private JLabel hitsLabel;
    private JLabel faultRateLabel;
    private JLabel replacementsLabel;

    public MetricsPanel() {
        setLayout(new GridLayout(6, 1, 10, 10));
        setBackground(new Color(240, 240, 240));
        setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));

        JLabel titleLabel = new JLabel("Simulation Metrics");
        titleLabel.setFont(new Font("Arial", Font.BOLD, 16));

        algorithmLabel = createLabel("Algorithm: -");
        pageFaultsLabel = createLabel("Page Faults: 0");
        hitsLabel = createLabel("Hits: 0");
        faultRateLabel = createLabel("Page Fault Rate: 0.00%");
        replacementsLabel = createLabel("Replacements: 0");

        add(titleLabel);
        add(algorithmLabel);
        add(pageFaultsLabel);
        add(hitsLabel);
        add(faultRateLabel);
        add(replacementsLabel);
    }

    private static JLabel createLabel(String text) {
        JLabel label = new JLabel(text);
        label.setFont(new Font("Arial", Font.PLAIN, 14));
        return label;
    }

    public void updateMetrics(SimulationResult result) {
        if (result != null) {
            algorithmLabel.setText("Algorithm: " + result.getAlgorithmName());
            pageFaultsLabel.setText("Page Faults: " + result.getFaultCount());
            hitsLabel.setText("Hits: " + result.getHitCount());
            faultRateLabel.setText("Page Fault Rate: " + SimulationReport.percent(result.getFaultRate()));
            replacementsLabel.setText("Replacements: " + result.getReplacementCount());
        }
    }
}

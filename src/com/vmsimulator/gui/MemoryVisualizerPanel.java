package com.vmsimulator.gui;

import com.vmsimulator.memory.FrameTable;
import com.vmsimulator.memory.SimulationResult;
import com.vmsimulator.memory.StepRecord;
import com.vmsimulator.simulator.SimulationReport;
import java.awt.*;
import java.util.Collections;
import java.util.List;
import javax.swing.*;
import javax.swing.table.DefaultTableModel;

/**
 * MemoryVisualizerPanel
 * - Arriba: canvas con una fila por frame y una columna por referencia; cada
 * celda muestra la página que ocupa el frame tras el paso.
 * - Abajo: tabla Step | Page | Result | Frames | Evicted.
 * - Llamar a updateData desde el EDT.
 */
public class MemoryVisualizerPanel extends JPanel {
  private final TraceCanvas canvas;
  private final DefaultTableModel tableModel;
  private final JLabel pageFaultsLabel;
  private final JLabel replacementsLabel;

  public MemoryVisualizerPanel() {
    setLayout(new BorderLayout());
    setBackground(new Color(250, 250, 250));

    canvas = new TraceCanvas();
    JScrollPane canvasScroll = new JScrollPane(canvas);
    canvasScroll.setPreferredSize(new Dimension(1000, 260));
    canvasScroll.setHorizontalScrollBarPolicy(ScrollPaneConstants.HORIZONTAL_SCROLLBAR_ALWAYS);

    // tabla
    tableModel = new DefaultTableModel(new String[] { "Step", "Page", "Result", "Frames", "Evicted" }, 0) {
      @Override
      public boolean isCellEditable(int row, int column) {
        return false;
      }
    };
    JTable stepTable = new JTable(tableModel);
    stepTable.setRowHeight(22);

    // stats
    JPanel stats = new JPanel(new FlowLayout(FlowLayout.LEFT));
    pageFaultsLabel = new JLabel("Page Faults: 0");
    replacementsLabel = new JLabel("Replacements: 0");
    stats.add(pageFaultsLabel);
    stats.add(Box.createHorizontalStrut(20));
    stats.add(replacementsLabel);

    add(canvasScroll, BorderLayout.NORTH);
    add(new JScrollPane(stepTable), BorderLayout.CENTER);
    add(stats, BorderLayout.SOUTH);
  }

  /**
   * Muestra el historial de una ejecución; null limpia el panel.
   */
  public void updateData(SimulationResult result) {
    tableModel.setRowCount(0);
    if (result == null) {
      pageFaultsLabel.setText("Page Faults: 0");
      replacementsLabel.setText("Replacements: 0");
      canvas.setHistory(Collections.emptyList(), 0);
      return;
    }

    List<StepRecord> history = result.getHistory();
    for (int i = 0; i < history.size(); i++) {
      StepRecord step = history.get(i);
      tableModel.addRow(new Object[] {
          i + 1,
          step.getPageAccessed(),
          step.isFault() ? "Fault" : "Hit",
          SimulationReport.formatFrames(step.frameStateAfter()),
          step.isReplacement() ? String.valueOf(step.getEvictedPage()) : "-" });
    }

    pageFaultsLabel.setText("Page Faults: " + result.getFaultCount());
    replacementsLabel.setText("Replacements: " + result.getReplacementCount());

    canvas.setHistory(history, result.getFrameCount());
    canvas.revalidate();
    canvas.repaint();
  }

  // --------- canvas: frames (filas) x referencias (columnas) ----------
  private static class TraceCanvas extends JPanel {
    private List<StepRecord> history = Collections.emptyList();
    private int frameCount = 0;

    private static final int ROW_HEIGHT = 26;
    private static final int ROW_SPACING = 6;
    private static final int LEFT_COL = 56;
    private static final int TICK_W = 26;
    private static final int TOP_PADDING = 34;
    private static final int RIGHT_PADDING = 40;

    private static final Color HIT = new Color(80, 180, 80);
    private static final Color LOAD = new Color(240, 160, 40);
    private static final Color EVICT = new Color(200, 80, 80);
    private static final Color RESIDENT = new Color(215, 225, 240);

    TraceCanvas() {
      setPreferredSize(new Dimension(1200, 300));
      setBackground(Color.WHITE);
    }

    void setHistory(List<StepRecord> history, int frameCount) {
      this.history = history;
      this.frameCount = frameCount;

      int rows = Math.max(1, frameCount);
      int height = TOP_PADDING + rows * (ROW_HEIGHT + ROW_SPACING) + 50;
      int width = LEFT_COL + history.size() * TICK_W + RIGHT_PADDING;
      setPreferredSize(new Dimension(Math.max(width, 600), Math.max(height, 180)));
    }

    @Override
    protected void paintComponent(Graphics g0) {
      super.paintComponent(g0);
      Graphics2D g = (Graphics2D) g0.create();
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

      g.setColor(new Color(250, 250, 250));
      g.fillRect(0, 0, getWidth(), getHeight());

      if (history.isEmpty()) {
        g.setColor(Color.DARK_GRAY);
        g.drawString("No simulation yet", LEFT_COL + 10, TOP_PADDING + 20);
        g.dispose();
        return;
      }

      FontMetrics fm = g.getFontMetrics();

      // cabecera: página referenciada y F/H por columna
      for (int s = 0; s < history.size(); s++) {
        StepRecord step = history.get(s);
        int x = LEFT_COL + s * TICK_W;
        g.setColor(step.isFault() ? EVICT : HIT);
        drawCentered(g, fm, step.isFault() ? "F" : "H", x, TICK_W, TOP_PADDING - 20);
        g.setColor(Color.BLACK);
        drawCentered(g, fm, String.valueOf(step.getPageAccessed()), x, TICK_W, TOP_PADDING - 6);
      }

      for (int frame = 0; frame < frameCount; frame++) {
        int y = TOP_PADDING + frame * (ROW_HEIGHT + ROW_SPACING);

        g.setColor(new Color(245, 245, 245));
        g.fillRect(0, y, LEFT_COL - 8, ROW_HEIGHT);
        g.setColor(Color.BLACK);
        g.drawString("F" + frame, 8, y + ROW_HEIGHT - 10);

        for (int s = 0; s < history.size(); s++) {
          StepRecord step = history.get(s);
          int page = step.frameStateAfter()[frame];
          int x = LEFT_COL + s * TICK_W;
          int w = TICK_W - 2;

          if (page == FrameTable.EMPTY) {
            g.setColor(new Color(235, 235, 235));
          } else if (step.isFault() && step.getFrameIndex() == frame) {
            g.setColor(step.isReplacement() ? EVICT : LOAD);
          } else if (!step.isFault() && page == step.getPageAccessed()) {
            g.setColor(HIT);
          } else {
            g.setColor(RESIDENT);
          }
          g.fillRoundRect(x + 1, y + 3, w, ROW_HEIGHT - 6, 6, 6);

          if (page != FrameTable.EMPTY) {
            g.setColor(Color.BLACK);
            drawCentered(g, fm, String.valueOf(page), x, w, y + (ROW_HEIGHT + fm.getAscent()) / 2 - 2);
          }
        }
      }

      // leyenda
      int legendY = getHeight() - 28;
      g.setColor(HIT);
      g.fillRect(LEFT_COL, legendY, 14, 10);
      g.setColor(Color.BLACK);
      g.drawString("Hit", LEFT_COL + 18, legendY + 10);

      g.setColor(LOAD);
      g.fillRect(LEFT_COL + 80, legendY, 14, 10);
      g.setColor(Color.BLACK);
      g.drawString("Load into free frame", LEFT_COL + 100, legendY + 10);

      g.setColor(EVICT);
      g.fillRect(LEFT_COL + 260, legendY, 14, 10);
      g.setColor(Color.BLACK);
      g.drawString("Replacement", LEFT_COL + 278, legendY + 10);

      g.dispose();
    }

    private static void drawCentered(Graphics2D g, FontMetrics fm, String text, int x, int width, int baseline) {
      int strW = fm.stringWidth(text);
      g.drawString(text, x + Math.max(2, (width - strW) / 2), baseline);
    }
  }
}
